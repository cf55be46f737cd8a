/* 
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package org.cltk.util;

import java.io.File;


/**
 * Locates the models that backends load.  All models live under a single data
 * root, laid out by language and then by the kind of model.  The root is taken
 * from the {@value #DATA_DIR_PROPERTY} system property and defaults to {@code
 * cltk_data} in the user's home directory.
 */
public final class CltkData {

    public static final String DATA_DIR_PROPERTY = "cltk.data";

    private CltkData() { }

    /**
     * Returns the current data root.  The property is read on each call so
     * that it can be changed at runtime.
     */
    public static File getDataDir() {
        String dir = System.getProperty(DATA_DIR_PROPERTY);
        if (dir == null)
            return new File(System.getProperty("user.home"), "cltk_data");
        return new File(dir);
    }

    /**
     * Returns the file {@code <root>/<language>/<path...>}.
     */
    public static File getModelFile(String language, String... path) {
        File f = new File(getDataDir(), language);
        for (String part : path)
            f = new File(f, part);
        return f;
    }
}
