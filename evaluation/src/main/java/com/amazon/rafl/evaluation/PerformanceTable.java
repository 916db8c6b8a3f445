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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Records the performance measures obtained with each of a number of parameter
 * sets, and picks the best parameter set according to one of the measures.
 */
public class PerformanceTable {

    private final List<String> measureNames;

    private final List<Map<String, Object>> parameterSets = new ArrayList<>();

    private final List<Map<String, PerformanceMeasure>> results = new ArrayList<>();

    /**
     * @param measureNames the measures every recorded result must contain, in the
     *                     order they are rendered
     */
    public PerformanceTable(List<String> measureNames) {
        checkNotNull(measureNames, "measureNames must not be null");
        checkArgument(!measureNames.isEmpty(), "there must be at least one measure");
        this.measureNames = Collections.unmodifiableList(new ArrayList<>(measureNames));
    }

    public void record(Map<String, ?> parameterSet, Map<String, PerformanceMeasure> measures) {
        checkNotNull(parameterSet, "parameterSet must not be null");
        checkNotNull(measures, "measures must not be null");
        for (String name : measureNames) {
            checkArgument(measures.containsKey(name), String.format("missing measure '%s'", name));
        }
        parameterSets.add(Collections.unmodifiableMap(new LinkedHashMap<>(parameterSet)));
        results.add(Collections.unmodifiableMap(new LinkedHashMap<>(measures)));
    }

    /**
     * @param measureName the measure to maximise
     * @return the parameter set with the highest mean value of the measure, the
     *         first one recorded in case of a tie, or empty if nothing was
     *         recorded.
     */
    public Optional<Map<String, Object>> getBestParameterSet(String measureName) {
        checkArgument(measureNames.contains(measureName), String.format("unknown measure '%s'", measureName));
        int best = -1;
        double bestMean = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < results.size(); i++) {
            double mean = results.get(i).get(measureName).getMean();
            if (mean > bestMean) {
                best = i;
                bestMean = mean;
            }
        }
        return best < 0 ? Optional.empty() : Optional.of(parameterSets.get(best));
    }

    public int size() {
        return results.size();
    }

    /**
     * @return one tab-separated line per recorded parameter set, preceded by a
     *         header line.
     */
    public String render() {
        StringBuilder sb = new StringBuilder("Parameters");
        for (String name : measureNames) {
            sb.append('\t').append(name);
        }
        sb.append('\n');
        for (int i = 0; i < results.size(); i++) {
            sb.append(ParameterSetProductGenerator.describe(parameterSets.get(i)));
            for (String name : measureNames) {
                sb.append('\t').append(results.get(i).get(name));
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
