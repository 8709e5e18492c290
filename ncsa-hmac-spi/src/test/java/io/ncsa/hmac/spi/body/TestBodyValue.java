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
import com.google.common.collect.ImmutableMap;
import io.ncsa.hmac.spi.body.BodyValue.ArrayValue;
import io.ncsa.hmac.spi.body.BodyValue.NullValue;
import io.ncsa.hmac.spi.body.BodyValue.NumberValue;
import io.ncsa.hmac.spi.body.BodyValue.ObjectValue;
import io.ncsa.hmac.spi.body.BodyValue.StringValue;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class TestBodyValue
{
    @Test
    public void testKeysAreStringifiedAndSorted()
    {
        Map<Object, Object> body = new LinkedHashMap<>();
        body.put("def", 456);
        body.put("abc", 123);
        body.put(123, 789);

        BodyValue value = BodyValue.of(body);
        assertThat(value).isInstanceOf(ObjectValue.class);
        assertThat(((ObjectValue) value).fields()).containsOnlyKeys("123", "abc", "def");
        assertThat(((ObjectValue) value).fields().keySet()).containsExactly("123", "abc", "def");
        assertThat(((ObjectValue) value).fields().get("123")).isEqualTo(new NumberValue(BigDecimal.valueOf(789)));
    }

    @Test
    public void testKeyOrderIsByUtf8Bytes()
    {
        // U+00E9 encodes to 0xC3 0xA9, after every ASCII key
        BodyValue value = BodyValue.of(ImmutableMap.of("é", 1, "z", 2, "Z", 3));
        assertThat(((ObjectValue) value).fields().keySet()).containsExactly("Z", "z", "é");
    }

    @Test
    public void testInsertionOrderDoesNotMatter()
    {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("a", 1);
        first.put("b", ImmutableMap.of("y", 1, "x", 2));
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("b", ImmutableMap.of("x", 2, "y", 1));
        second.put("a", 1);

        assertThat(BodyValue.of(first)).isEqualTo(BodyValue.of(second));
    }

    @Test
    public void testDuplicateStringifiedKeys()
    {
        Map<Object, Object> body = new LinkedHashMap<>();
        body.put(1, "a");
        body.put("1", "b");

        assertThatThrownBy(() -> BodyValue.of(body))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("duplicate key");
    }

    @Test
    public void testScalarsAndNesting()
    {
        assertThat(BodyValue.of(null)).isEqualTo(NullValue.INSTANCE);
        assertThat(BodyValue.of("text")).isEqualTo(new StringValue("text"));
        assertThat(BodyValue.of(true)).isEqualTo(new BodyValue.BooleanValue(true));
        assertThat(BodyValue.of(1.5)).isEqualTo(new NumberValue(new BigDecimal("1.5")));
        assertThat(BodyValue.of(ImmutableList.of(1, "a"))).isEqualTo(new ArrayValue(ImmutableList.of(new NumberValue(BigDecimal.ONE), new StringValue("a"))));
        assertThat(BodyValue.of(new Object[] {null, 2})).isEqualTo(BodyValue.of(Arrays.asList(null, 2)));

        assertThatThrownBy(() -> BodyValue.of(Double.NaN))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not finite");
        assertThatThrownBy(() -> BodyValue.of(new Object()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("Unsupported body value type");
    }

    @Test
    public void testEmptyBody()
    {
        assertThat(ObjectValue.EMPTY.isEmptyBody()).isTrue();
        assertThat(BodyValue.of(ImmutableMap.of()).isEmptyBody()).isTrue();
        assertThat(BodyValue.of("").isEmptyBody()).isFalse();
        assertThat(BodyValue.of(ImmutableList.of()).isEmptyBody()).isFalse();
        assertThat(BodyValue.of(ImmutableMap.of("a", 1)).isEmptyBody()).isFalse();
    }
}
