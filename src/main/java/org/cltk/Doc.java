/* 
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package org.cltk;

import java.util.List;


/**
 * A document being annotated by a sequence of {@link Process}es.  Processes
 * mutate the words of a document in place; they never replace the word list.
 */
public interface Doc {

    /**
     * Returns the text from which the words were tokenized.
     */
    String getRaw();

    /**
     * Returns the words of this document in their original order.  The list
     * is the document's own, not a copy.
     */
    List<Word> getWords();
}
