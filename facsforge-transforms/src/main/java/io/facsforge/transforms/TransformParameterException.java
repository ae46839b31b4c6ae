package io.facsforge.transforms;

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

/// Thrown when transform parameters are invalid or cannot be solved.
///
/// Raised when a transform is constructed, never on first use.
public class TransformParameterException extends IllegalArgumentException {

    /// @param message what is wrong with the parameters
    public TransformParameterException(String message) {
        super(message);
    }

    /// @param message what is wrong with the parameters
    /// @param cause   the underlying failure
    public TransformParameterException(String message, Throwable cause) {
        super(message, cause);
    }
}
