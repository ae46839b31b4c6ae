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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ChannelTransformsTest {

    @Test
    void undeclaredChannelsAreLinear() {
        ChannelTransforms transforms = ChannelTransforms.builder()
            .logicle("FITC-A", LogicleParameters.defaults())
            .build();

        assertThat(transforms.forChannel("FSC-A")).isSameAs(LinearTransform.identity());
        assertThat(transforms.isDeclared("FSC-A")).isFalse();
        assertThat(transforms.forChannel("FITC-A")).isInstanceOf(LogicleTransform.class);
        assertThat(transforms.declaredChannels()).containsExactly("FITC-A");
    }

    @Test
    void rolesFollowTransforms() {
        ChannelTransforms transforms = ChannelTransforms.builder()
            .logicle("PE-A", LogicleParameters.defaults())
            .linear("Time", 0, 1000)
            .build();

        assertThat(transforms.channel("PE-A").role()).isEqualTo(ChannelRole.FLUORESCENCE_LOGICLE);
        assertThat(transforms.channel("Time").role()).isEqualTo(ChannelRole.TIME_LINEAR);
        assertThat(transforms.channel("SSC-H").role()).isEqualTo(ChannelRole.SCATTER_LINEAR);
        // a fluorescence detector without logicle metadata is displayed linearly
        assertThat(transforms.channel("APC-A").role()).isEqualTo(ChannelRole.SCATTER_LINEAR);
    }

    @Test
    void invalidParametersFailWhileBuilding() {
        assertThatThrownBy(() -> ChannelTransforms.builder()
            .logicle("PE-A", new LogicleParameters(10000, 5.0, 4.5, 0)))
            .isInstanceOf(TransformParameterException.class);
    }

    @Test
    void defaultRolesByName() {
        assertThat(ChannelRoles.defaultRole("FSC-A")).isEqualTo(ChannelRole.SCATTER_LINEAR);
        assertThat(ChannelRoles.defaultRole("SSC (Violet)-A")).isEqualTo(ChannelRole.SCATTER_LINEAR);
        assertThat(ChannelRoles.defaultRole("Time")).isEqualTo(ChannelRole.TIME_LINEAR);
        assertThat(ChannelRoles.defaultRole("BV421-A")).isEqualTo(ChannelRole.FLUORESCENCE_LOGICLE);
        assertThat(ChannelRole.fromWireName("Fluorescence-Logicle")).isEqualTo(ChannelRole.FLUORESCENCE_LOGICLE);
        assertThatThrownBy(() -> ChannelRole.fromWireName("log")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void channelsCarryTheirRole() {
        assertThat(Channel.named("Time")).isEqualTo(new Channel("Time", ChannelRole.TIME_LINEAR));
        assertThat(Channel.named("PE-Cy7-A").role()).isEqualTo(ChannelRole.FLUORESCENCE_LOGICLE);
        assertThatThrownBy(() -> new Channel(" ", ChannelRole.SCATTER_LINEAR))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
