/* 
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package org.cltk;

import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;


/**
 * Thrown when a {@link Process} is configured with a value outside the set it
 * supports.  The exception is raised when the configuration is first used,
 * not when it is created.
 */
public class ConfigurationException extends CltkException {

    private static final long serialVersionUID = 1L;

    private final String invalidValue;

    private final List<String> validOptions;

    /**
     * @param setting the name of the misconfigured setting, e.g. "embeddings
     *        variant"
     * @param invalidValue the value that was configured
     * @param validOptions the values that would have been accepted
     */
    public ConfigurationException(String setting, String invalidValue,
                                  List<String> validOptions) {
        super(String.format("Invalid %s '%s'. Available: '%s'.", setting,
                            invalidValue,
                            Joiner.on("', '").join(validOptions)));
        this.invalidValue = invalidValue;
        this.validOptions = ImmutableList.copyOf(validOptions);
    }

    /**
     * Returns the rejected value, which may be {@code null}.
     */
    public String getInvalidValue() {
        return invalidValue;
    }

    public List<String> getValidOptions() {
        return validOptions;
    }
}
