package io.facsforge.gating.engine;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

/**
 * Naming rules for populations and the files written for them.
 */
public final class PopulationNames {

    private PopulationNames() {
    }

    /**
     * @param siblingIndex 1-based position among siblings
     * @return the name given to a population that has none
     */
    public static String unnamed(int siblingIndex) {
        return "Population" + siblingIndex;
    }

    /**
     * Turns a population path into a file name stem. Path separators become {@code __};
     * anything other than letters, digits, {@code + - . _} becomes {@code _}.
     *
     * <pre>{@code
     * Lymphocytes/Singlets/CD3+  ->  Lymphocytes__Singlets__CD3+
     * CD4 T cells                ->  CD4_T_cells
     * }</pre>
     *
     * @param path population path
     * @return a deterministic, file-system safe stem
     */
    public static String fileStem(String path) {
        String[] parts = path.split("/", -1);
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) {
                sb.append("__");
            }
            for (char ch : parts[i].toCharArray()) {
                boolean safe = (ch < 128 && Character.isLetterOrDigit(ch)) || ch == '+' || ch == '-' || ch == '.'
                    || ch == '_';
                sb.append(safe ? ch : '_');
            }
        }
        return sb.toString();
    }
}
