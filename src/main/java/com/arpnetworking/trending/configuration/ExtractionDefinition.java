/*
 * Copyright 2026 Inscope Metrics
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.arpnetworking.trending.configuration;

import com.arpnetworking.commons.builder.OvalBuilder;
import com.arpnetworking.logback.annotations.Loggable;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import net.sf.oval.constraint.MinSize;
import net.sf.oval.constraint.NotEmpty;
import net.sf.oval.constraint.NotNull;

import java.util.List;

/**
 * A routine that extracts a set of mnemonics while a condition set holds.
 *
 * @author Inscope Metrics
 */
@Loggable
@JsonDeserialize(builder = ExtractionDefinition.Builder.class)
public final class ExtractionDefinition {

    public String getName() {
        return _name;
    }

    public ImmutableList<ConditionDefinition> getConditions() {
        return _conditions;
    }

    public ImmutableList<String> getMnemonics() {
        return _mnemonics;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Name", _name)
                .add("Conditions", _conditions)
                .add("Mnemonics", _mnemonics)
                .toString();
    }

    private ExtractionDefinition(final Builder builder) {
        _name = builder._name;
        _conditions = ImmutableList.copyOf(builder._conditions);
        _mnemonics = ImmutableList.copyOf(builder._mnemonics);
    }

    private final String _name;
    private final ImmutableList<ConditionDefinition> _conditions;
    private final ImmutableList<String> _mnemonics;

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link ExtractionDefinition}.
     */
    @JsonPOJOBuilder(withPrefix = "set")
    public static final class Builder extends OvalBuilder<ExtractionDefinition> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(ExtractionDefinition::new);
        }

        /**
         * Set the routine name. Required. Cannot be null or empty.
         *
         * @param value The name.
         * @return This {@link Builder} instance.
         */
        public Builder setName(final String value) {
            _name = value;
            return this;
        }

        /**
         * Set the condition set. Required. Cannot be null or empty.
         *
         * @param value The conditions.
         * @return This {@link Builder} instance.
         */
        public Builder setConditions(final List<ConditionDefinition> value) {
            _conditions = value;
            return this;
        }

        /**
         * Set the mnemonics to extract. Required. Cannot be null or empty.
         *
         * @param value The mnemonic identifiers.
         * @return This {@link Builder} instance.
         */
        public Builder setMnemonics(final List<String> value) {
            _mnemonics = value;
            return this;
        }

        @NotNull
        @NotEmpty
        private String _name;
        @NotNull
        @MinSize(1)
        private List<ConditionDefinition> _conditions;
        @NotNull
        @MinSize(1)
        private List<String> _mnemonics;
    }
}
