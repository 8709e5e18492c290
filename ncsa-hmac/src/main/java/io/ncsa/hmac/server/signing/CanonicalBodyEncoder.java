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
package io.ncsa.hmac.server.signing;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.StreamWriteFeature;
import io.ncsa.hmac.spi.body.BodyValue;
import io.ncsa.hmac.spi.body.BodyValue.ArrayValue;
import io.ncsa.hmac.spi.body.BodyValue.BooleanValue;
import io.ncsa.hmac.spi.body.BodyValue.NullValue;
import io.ncsa.hmac.spi.body.BodyValue.NumberValue;
import io.ncsa.hmac.spi.body.BodyValue.ObjectValue;
import io.ncsa.hmac.spi.body.BodyValue.StringValue;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Map;

/**
 * Compact JSON rendering of a {@link BodyValue}: no insignificant whitespace, object keys in
 * canonical order at every level, numbers in plain notation.
 */
final class CanonicalBodyEncoder
{
    private static final JsonFactory JSON_FACTORY = JsonFactory.builder()
            .enable(StreamWriteFeature.WRITE_BIGDECIMAL_AS_PLAIN)
            .build();

    private CanonicalBodyEncoder() {}

    static byte[] encode(BodyValue body)
    {
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        try (JsonGenerator generator = JSON_FACTORY.createGenerator(output)) {
            write(generator, body);
        }
        catch (IOException e) {
            throw new UncheckedIOException("Failed to encode request body", e);
        }
        return output.toByteArray();
    }

    private static void write(JsonGenerator generator, BodyValue value)
            throws IOException
    {
        if (value instanceof ObjectValue objectValue) {
            generator.writeStartObject();
            for (Map.Entry<String, BodyValue> field : objectValue.fields().entrySet()) {
                generator.writeFieldName(field.getKey());
                write(generator, field.getValue());
            }
            generator.writeEndObject();
        }
        else if (value instanceof ArrayValue arrayValue) {
            generator.writeStartArray();
            for (BodyValue element : arrayValue.elements()) {
                write(generator, element);
            }
            generator.writeEndArray();
        }
        else if (value instanceof StringValue stringValue) {
            generator.writeString(stringValue.value());
        }
        else if (value instanceof NumberValue numberValue) {
            generator.writeNumber(numberValue.value());
        }
        else if (value instanceof BooleanValue booleanValue) {
            generator.writeBoolean(booleanValue.value());
        }
        else if (value instanceof NullValue) {
            generator.writeNull();
        }
        else {
            throw new IllegalArgumentException("Unknown body value: " + value);
        }
    }
}
