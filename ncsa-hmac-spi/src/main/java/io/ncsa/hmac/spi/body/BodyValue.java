/*
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
package io.ncsa.hmac.spi.body;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.primitives.UnsignedBytes;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import static com.google.common.base.Preconditions.checkArgument;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * Request body as it takes part in a content digest. Object keys are kept in canonical order
 * (unsigned lexicographic order of their UTF-8 bytes) so two bodies with the same content compare
 * equal regardless of the order in which their keys were inserted.
 */
public sealed interface BodyValue
        permits BodyValue.ObjectValue, BodyValue.ArrayValue, BodyValue.StringValue, BodyValue.NumberValue, BodyValue.BooleanValue, BodyValue.NullValue
{
    Comparator<String> KEY_ORDER = Comparator.comparing(key -> key.getBytes(UTF_8), UnsignedBytes.lexicographicalComparator());

    record ObjectValue(SortedMap<String, BodyValue> fields)
            implements BodyValue
    {
        public static final ObjectValue EMPTY = new ObjectValue(ImmutableSortedMap.of());

        public ObjectValue
        {
            fields = ImmutableSortedMap.copyOf(fields, KEY_ORDER);
        }

        public boolean isEmpty()
        {
            return fields.isEmpty();
        }
    }

    record ArrayValue(List<BodyValue> elements)
            implements BodyValue
    {
        public ArrayValue
        {
            elements = ImmutableList.copyOf(elements);
        }
    }

    record StringValue(String value)
            implements BodyValue
    {
        public StringValue
        {
            requireNonNull(value, "value is null");
        }
    }

    record NumberValue(BigDecimal value)
            implements BodyValue
    {
        public NumberValue
        {
            requireNonNull(value, "value is null");
        }
    }

    record BooleanValue(boolean value)
            implements BodyValue
    {
    }

    record NullValue()
            implements BodyValue
    {
        public static final NullValue INSTANCE = new NullValue();
    }

    /**
     * An absent body and an empty object are interchangeable for signing purposes. An empty raw
     * string is not: it digests like any other string.
     */
    default boolean isEmptyBody()
    {
        return (this instanceof ObjectValue objectValue) && objectValue.isEmpty();
    }

    static BodyValue of(Object value)
    {
        if (value == null) {
            return NullValue.INSTANCE;
        }
        if (value instanceof BodyValue bodyValue) {
            return bodyValue;
        }
        if (value instanceof Map<?, ?> map) {
            return objectValue(map);
        }
        if (value instanceof Iterable<?> iterable) {
            ImmutableList.Builder<BodyValue> elements = ImmutableList.builder();
            iterable.forEach(element -> elements.add(of(element)));
            return new ArrayValue(elements.build());
        }
        if (value instanceof Object[] array) {
            return of(Arrays.asList(array));
        }
        if (value instanceof CharSequence charSequence) {
            return new StringValue(charSequence.toString());
        }
        if (value instanceof Boolean booleanValue) {
            return new BooleanValue(booleanValue);
        }
        if (value instanceof Number number) {
            return new NumberValue(toBigDecimal(number));
        }
        throw new IllegalArgumentException("Unsupported body value type: " + value.getClass().getName());
    }

    private static ObjectValue objectValue(Map<?, ?> map)
    {
        SortedMap<String, BodyValue> fields = new TreeMap<>(KEY_ORDER);
        map.forEach((key, value) -> {
            String stringKey = String.valueOf(key);
            BodyValue previous = fields.put(stringKey, of(value));
            checkArgument(previous == null, "Body contains duplicate key after conversion to string: %s", stringKey);
        });
        return new ObjectValue(fields);
    }

    private static BigDecimal toBigDecimal(Number number)
    {
        if (number instanceof BigDecimal bigDecimal) {
            return bigDecimal;
        }
        if (number instanceof BigInteger bigInteger) {
            return new BigDecimal(bigInteger);
        }
        if ((number instanceof Double) || (number instanceof Float)) {
            double doubleValue = number.doubleValue();
            checkArgument(Double.isFinite(doubleValue), "Body number is not finite: %s", number);
            return new BigDecimal(number.toString());
        }
        return BigDecimal.valueOf(number.longValue());
    }
}
