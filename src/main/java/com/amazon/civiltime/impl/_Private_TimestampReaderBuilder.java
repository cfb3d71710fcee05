// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.civiltime.impl;

import com.amazon.civiltime.system.TimestampReaderBuilder;

/**
 * {@link TimestampReaderBuilder} extension for internal use only.
 */
public class _Private_TimestampReaderBuilder extends TimestampReaderBuilder {

    private _Private_TimestampReaderBuilder() {
        super();
    }

    private _Private_TimestampReaderBuilder(TimestampReaderBuilder that) {
        super(that);
    }

    public static class Mutable extends _Private_TimestampReaderBuilder {

        public Mutable() {
        }

        public Mutable(TimestampReaderBuilder that) {
            super(that);
        }

        @Override
        public TimestampReaderBuilder immutable() {
            return new _Private_TimestampReaderBuilder(this);
        }

        @Override
        public TimestampReaderBuilder mutable() {
            return this;
        }

        @Override
        protected void mutationCheck() {
        }
    }
}
