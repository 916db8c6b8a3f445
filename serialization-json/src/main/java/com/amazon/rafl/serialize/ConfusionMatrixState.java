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

package com.amazon.rafl.serialize;

import java.io.Serializable;
import java.util.List;

import lombok.Data;

/**
 * A POJO holding the content of a confusion matrix. Labels are stored as
 * strings, in label order, and {@code counts[i][j]} is the number of examples
 * with label {@code labels[i]} predicted as {@code labels[j]}.
 */
@Data
public class ConfusionMatrixState implements Serializable {
    private static final long serialVersionUID = 1L;

    private List<String> labels;

    private long[][] counts;
}
