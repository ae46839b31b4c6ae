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

import java.util.Collection;
import java.util.List;

/**
 * Thrown when gating references a channel that the event matrix does not carry.
 */
public class ChannelNotFoundException extends RuntimeException {

    private final List<String> missingChannels;

    /**
     * @param missingChannels every channel that was looked for and not found
     */
    public ChannelNotFoundException(Collection<String> missingChannels) {
        super("Channel(s) not found in event data: " + String.join(", ", missingChannels));
        this.missingChannels = List.copyOf(missingChannels);
    }

    /**
     * @param message         detail message
     * @param missingChannels the missing channels
     */
    public ChannelNotFoundException(String message, Collection<String> missingChannels) {
        super(message);
        this.missingChannels = List.copyOf(missingChannels);
    }

    /**
     * @return the channels that were not found
     */
    public List<String> getMissingChannels() {
        return missingChannels;
    }
}
