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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Immutable channel → transform registry for one analysis run.
///
/// Channels without a declared transform are displayed linearly. This is the
/// documented default for scatter and time channels, and for fluorescence channels
/// whose source carried no logicle metadata.
public final class ChannelTransforms {

    private static final ChannelTransforms EMPTY = new ChannelTransforms(Map.of());

    private final Map<String, ChannelTransform> transforms;

    private ChannelTransforms(Map<String, ChannelTransform> transforms) {
        this.transforms = Collections.unmodifiableMap(new LinkedHashMap<>(transforms));
    }

    /// @return a registry with no declared transforms
    public static ChannelTransforms linearOnly() {
        return EMPTY;
    }

    /// @return a new builder
    public static Builder builder() {
        return new Builder();
    }

    /// @param channel a channel identifier
    /// @return the declared transform, or the identity transform when none was declared
    public ChannelTransform forChannel(String channel) {
        ChannelTransform transform = transforms.get(channel);
        return transform != null ? transform : LinearTransform.identity();
    }

    /// @param channel a channel identifier
    /// @return true if a transform was declared for this channel
    public boolean isDeclared(String channel) {
        return transforms.containsKey(channel);
    }

    /// @return the channels with a declared transform, in declaration order
    public Set<String> declaredChannels() {
        return transforms.keySet();
    }

    /// @return the declared transforms, in declaration order
    public Map<String, ChannelTransform> asMap() {
        return transforms;
    }

    /// @param channel a channel identifier
    /// @return the channel with the role its transform implies
    public Channel channel(String channel) {
        return new Channel(channel, ChannelRoles.roleFor(channel, forChannel(channel)));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ChannelTransforms)) return false;
        return transforms.equals(((ChannelTransforms) o).transforms);
    }

    @Override
    public int hashCode() {
        return Objects.hash(transforms);
    }

    @Override
    public String toString() {
        return "ChannelTransforms" + transforms;
    }

    /// Collects transforms. Logicle parameters are solved as they are added, so an
    /// unusable parameter set fails here rather than during evaluation.
    public static final class Builder {
        private final Map<String, ChannelTransform> transforms = new LinkedHashMap<>();

        private Builder() {
        }

        /// @param channel channel identifier
        /// @return this builder
        public Builder linear(String channel) {
            return put(channel, LinearTransform.identity());
        }

        /// @param channel channel identifier
        /// @param min     lower axis limit
        /// @param max     upper axis limit
        /// @return this builder
        public Builder linear(String channel, double min, double max) {
            return put(channel, LinearTransform.withRange(min, max));
        }

        /// @param channel    channel identifier
        /// @param parameters logicle parameters to solve
        /// @return this builder
        /// @throws TransformParameterException if the parameters cannot be solved
        public Builder logicle(String channel, LogicleParameters parameters) {
            return put(channel, LogicleTransform.create(parameters));
        }

        /// @param channel   channel identifier
        /// @param transform a ready transform
        /// @return this builder
        public Builder put(String channel, ChannelTransform transform) {
            Objects.requireNonNull(channel, "channel");
            Objects.requireNonNull(transform, "transform");
            transforms.put(channel, transform);
            return this;
        }

        /// @return the immutable registry
        public ChannelTransforms build() {
            return transforms.isEmpty() ? EMPTY : new ChannelTransforms(transforms);
        }
    }
}
