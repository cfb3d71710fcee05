// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.civiltime.impl;

import com.amazon.civiltime.system.TimestampWriterBuilder;

/**
 * {@link TimestampWriterBuilder} extension for internal use only.
 */
public class _Private_TimestampWriterBuilder extends TimestampWriterBuilder {

    private _Private_TimestampWriterBuilder() {
        super();
    }

    private _Private_TimestampWriterBuilder(TimestampWriterBuilder that) {
        super(that);
    }

    public static class Mutable extends _Private_TimestampWriterBuilder {

        public Mutable() {
        }

        public Mutable(TimestampWriterBuilder that) {
            super(that);
        }

        @Override
        public TimestampWriterBuilder immutable() {
            return new _Private_TimestampWriterBuilder(this);
        }

        @Override
        public TimestampWriterBuilder mutable() {
            return this;
        }

        @Override
        protected void mutationCheck() {
        }
    }
}
