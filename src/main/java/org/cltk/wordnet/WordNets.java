/* 
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package org.cltk.wordnet;

import java.io.File;
import java.io.IOError;
import java.io.IOException;

import java.util.Map;

import com.google.common.collect.ImmutableMap;

import edu.mit.jwi.Dictionary;
import edu.mit.jwi.IDictionary;

import org.cltk.util.CltkData;
import org.cltk.util.CltkLogger;


/**
 * The languages that have a WordNet and where their dictionaries are found.
 */
public final class WordNets {

    /**
     * The language codes that have a WordNet, mapped to the code of their
     * WordNet.
     */
    public static final Map<String,String> LANGUAGE_TO_WORDNET_CODE =
        ImmutableMap.of("lat", "lat",
                        "grc", "grk",
                        "san", "skt");

    /**
     * Opens the WordNet in {@code <data>/<language>/wordnet/<code>/dict} with
     * JWI.
     */
    public static final WordNetReaderFactory FACTORY =
        new WordNetReaderFactory() {
            public IDictionary newReader(String wordNetCode) {
                File dictDir = getDictionaryDir(wordNetCode);
                CltkLogger.verbose("Opening WordNet %s at %s",
                                   wordNetCode, dictDir);
                try {
                    IDictionary dict = new Dictionary(dictDir.toURI().toURL());
                    dict.open();
                    return dict;
                } catch (IOException ioe) {
                    throw new IOError(ioe);
                }
            }
        };

    private WordNets() { }

    /**
     * Returns the code of the language's WordNet or {@code null} if it has
     * none.
     */
    public static String getWordNetCode(String language) {
        return (language == null) ? null
            : LANGUAGE_TO_WORDNET_CODE.get(language);
    }

    /**
     * Returns the directory holding the dictionary files of the WordNet with
     * this code.
     */
    public static File getDictionaryDir(String wordNetCode) {
        for (Map.Entry<String,String> e : LANGUAGE_TO_WORDNET_CODE.entrySet()) {
            if (e.getValue().equals(wordNetCode)) {
                return CltkData.getModelFile(e.getKey(), "wordnet",
                                             wordNetCode, "dict");
            }
        }
        throw new IllegalArgumentException("Unknown WordNet: " + wordNetCode);
    }
}
