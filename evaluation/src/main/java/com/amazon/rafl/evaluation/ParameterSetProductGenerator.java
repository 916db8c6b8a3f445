/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.rafl.evaluation;

import static com.amazon.rafl.CommonUtils.checkArgument;
import static com.amazon.rafl.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Generates every combination of a set of named parameter values, for example
 * to search for the classifier settings that perform best. The parameter sets
 * are maps from name to value, suitable for
 * {@code RandomForest.Builder#parameters}.
 */
public class ParameterSetProductGenerator {

    private final Map<String, List<Object>> parameters = new LinkedHashMap<>();

    public ParameterSetProductGenerator addParameter(String name, Object... values) {
        return addParameter(name, Arrays.asList(values));
    }

    /**
     * @param name   the name of the parameter
     * @param values the values it may take, at least one
     * @return this generator
     */
    public ParameterSetProductGenerator addParameter(String name, List<?> values) {
        checkNotNull(name, "name must not be null");
        checkNotNull(values, "values must not be null");
        checkArgument(!values.isEmpty(), String.format("parameter '%s' needs at least one value", name));
        checkArgument(!parameters.containsKey(name), String.format("parameter '%s' was already added", name));
        parameters.put(name, new ArrayList<>(values));
        return this;
    }

    /**
     * Parameter sets are produced in odometer order: the parameter added last
     * varies fastest.
     *
     * @return the cartesian product of the parameter values; a single empty set
     *         if no parameter was added.
     */
    public List<Map<String, Object>> generateParameterSets() {
        List<Map<String, Object>> result = new ArrayList<>();
        result.add(Collections.emptyMap());
        for (Map.Entry<String, List<Object>> parameter : parameters.entrySet()) {
            List<Map<String, Object>> extended = new ArrayList<>(result.size() * parameter.getValue().size());
            for (Map<String, Object> partial : result) {
                for (Object value : parameter.getValue()) {
                    Map<String, Object> set = new LinkedHashMap<>(partial);
                    set.put(parameter.getKey(), value);
                    extended.add(set);
                }
            }
            result = extended;
        }
        return result;
    }

    /**
     * @param parameterSet a parameter set
     * @return a single-line description of the set, e.g. {@code "a=1, b=true"}
     */
    public static String describe(Map<String, ?> parameterSet) {
        return parameterSet.entrySet().stream().map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(", "));
    }
}
