/*
 * The MIT License
 *
 * Copyright 2025 Karate Labs Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.stencil.data;

import java.math.BigInteger;

public final class IntegerValue extends Value {

    public static final BigInteger MAX = BigInteger.ONE.shiftLeft(127).subtract(BigInteger.ONE);
    public static final BigInteger MIN = BigInteger.ONE.shiftLeft(127).negate();

    private final BigInteger value;

    IntegerValue(Store store, BigInteger value) {
        super(store);
        if (!inRange(value)) {
            throw new IllegalArgumentException("integer out of 128-bit range: " + value);
        }
        this.value = value;
    }

    public static boolean inRange(BigInteger value) {
        return value != null && value.compareTo(MIN) >= 0 && value.compareTo(MAX) <= 0;
    }

    @Override
    public Type getType() {
        return Type.INTEGER;
    }

    public BigInteger getValue() {
        return value;
    }

    public long longValue() {
        return value.longValueExact();
    }

    @Override
    public Object getJavaValue() {
        return value;
    }

    @Override
    public String toString() {
        return value.toString();
    }

}
