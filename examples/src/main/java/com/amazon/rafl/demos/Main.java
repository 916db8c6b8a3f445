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

package com.amazon.rafl.demos;

import java.util.Map;
import java.util.TreeMap;

import com.amazon.rafl.demos.evaluation.CrossValidationDemo;
import com.amazon.rafl.demos.evaluation.GridSearchDemo;
import com.amazon.rafl.demos.online.OnlineLabellingDemo;

public class Main {

    public static final String ARCHIVE_NAME = "rafl-examples-1.0.0.jar";

    public static void main(String[] args) throws Exception {
        new Main().run(args);
    }

    private final Map<String, Demo> demos;
    private int maxCommandLength;

    public Main() {
        demos = new TreeMap<>();
        maxCommandLength = 0;
        add(new OnlineLabellingDemo());
        add(new CrossValidationDemo());
        add(new GridSearchDemo());
    }

    private void add(Demo demo) {
        demos.put(demo.command(), demo);
        if (maxCommandLength < demo.command().length()) {
            maxCommandLength = demo.command().length();
        }
    }

    public void run(String[] args) throws Exception {
        if (args == null || args.length < 1 || args[0].equals("-h") || args[0].equals("--help")) {
            printUsage();
            return;
        }

        String command = args[0];
        if (!demos.containsKey(command)) {
            throw new IllegalArgumentException("No such example: " + command);
        }

        demos.get(command).run();
    }

    public void printUsage() {
        System.out.printf("Usage: java -cp %s %s [example]%n", ARCHIVE_NAME, Main.class.getName());
        System.out.println("Examples:");
        String formatString = String.format("\t %%%ds - %%s%%n", maxCommandLength);
        for (Demo demo : demos.values()) {
            System.out.printf(formatString, demo.command(), demo.description());
        }
    }
}
