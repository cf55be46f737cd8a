/* 
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package org.cltk;

import java.util.Collection;
import java.util.TreeSet;


/**
 * Thrown by a backend that has no model for the requested language.
 */
public class UnknownLanguageException extends CltkException {

    private static final long serialVersionUID = 1L;

    private final String language;

    public UnknownLanguageException(String backend, String language,
                                    Collection<String> supported) {
        super(String.format("No %s model for language '%s'. Supported: %s",
                            backend, language, new TreeSet<String>(supported)));
        this.language = language;
    }

    public String getLanguage() {
        return language;
    }
}
