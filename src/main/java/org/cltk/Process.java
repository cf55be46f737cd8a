/* 
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package org.cltk;


/**
 * A configured unit of document annotation.  A process reads its input {@link
 * Doc}, enriches its words in place and exposes the result as its output
 * document when {@link #run()} returns.
 *
 * <p>Processes resolve their language-specific algorithm lazily and are not
 * safe for use by multiple threads at once.
 */
public interface Process {

    /**
     * Returns the code of the language this process is configured for.
     */
    String getLanguage();

    /**
     * Returns a human-readable description of what this process does.
     */
    String getDescription();

    /**
     * Sets the document that the next call to {@link #run()} annotates.
     */
    void setInputDoc(Doc doc);

    Doc getInputDoc();

    /**
     * Returns the annotated document, or {@code null} if {@link #run()} has
     * not completed yet.
     */
    Doc getOutputDoc();

    /**
     * Annotates the input document.
     *
     * @throws ConfigurationException if the process's configuration names an
     *         unsupported option
     * @throws IllegalStateException if no input document has been set
     */
    void run();
}
