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

import java.math.BigDecimal;

public final class FloatValue extends Value {

    private final double value;

    FloatValue(Store store, double value) {
        super(store);
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("float must be finite: " + value);
        }
        this.value = value;
    }

    @Override
    public Type getType() {
        return Type.FLOAT;
    }

    public double getValue() {
        return value;
    }

    @Override
    public Object getJavaValue() {
        return value;
    }

    /**
     * JSON form: plain decimal that always keeps a decimal point so that the
     * literal decodes back into a float.
     */
    static String toJsonNumber(double value) {
        String plain = BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
        return plain.indexOf('.') == -1 ? plain + ".0" : plain;
    }

    @Override
    public String toString() {
        return Coercion.formatDecimal(value);
    }

}
