/* 
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package org.cltk.wordnet;

import edu.mit.jwi.IDictionary;


/**
 * Opens the WordNet of a language.
 */
public interface WordNetReaderFactory {

    /**
     * Returns an open dictionary for the WordNet with this code, e.g. {@code
     * "grk"} for Ancient Greek.
     *
     * @throws java.io.IOError if the WordNet could not be opened
     */
    IDictionary newReader(String wordNetCode);
}
