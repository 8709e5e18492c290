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
package io.ncsa.hmac.server.rest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.LinkedListMultimap;
import com.google.common.collect.ListMultimap;
import io.airlift.json.ObjectMapperProvider;
import io.airlift.log.Logger;
import io.ncsa.hmac.spi.body.BodyValue;
import io.ncsa.hmac.spi.body.BodyValue.ArrayValue;
import io.ncsa.hmac.spi.body.BodyValue.BooleanValue;
import io.ncsa.hmac.spi.body.BodyValue.NullValue;
import io.ncsa.hmac.spi.body.BodyValue.NumberValue;
import io.ncsa.hmac.spi.body.BodyValue.ObjectValue;
import io.ncsa.hmac.spi.body.BodyValue.StringValue;
import io.ncsa.hmac.spi.signing.RequestDetails;
import jakarta.ws.rs.WebApplicationException;
import org.glassfish.jersey.server.ContainerRequest;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.net.URLDecoder;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

import static com.google.common.io.ByteStreams.toByteArray;
import static io.ncsa.hmac.spi.rest.RequestAdapter.CONTENT_TYPE_HEADER;
import static io.ncsa.hmac.spi.rest.RequestAdapter.DATE_HEADER;
import static jakarta.ws.rs.core.Response.Status.BAD_REQUEST;
import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Takes the signing snapshot of an inbound Jersey request. The entity is buffered and put back so
 * the resource method can still read it.
 */
public final class RequestDetailsBuilder
{
    private static final Logger log = Logger.get(RequestDetailsBuilder.class);

    // decimals keep the scale the client sent, 1.0 and 1 digest differently
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapperProvider().get()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
            .setNodeFactory(JsonNodeFactory.withExactBigDecimals(true));
    private static final Splitter FORM_PAIR_SPLITTER = Splitter.on('&').omitEmptyStrings();
    private static final Splitter FORM_VALUE_SPLITTER = Splitter.on('=').limit(2);

    private RequestDetailsBuilder() {}

    public static RequestDetails fromRequest(ContainerRequest request)
    {
        String contentType = Optional.ofNullable(request.getHeaderString(CONTENT_TYPE_HEADER)).orElse("");

        byte[] entity;
        try {
            entity = toByteArray(request.getEntityStream());
        }
        catch (IOException e) {
            log.debug(e, "Failed to read request entity");
            throw new WebApplicationException(BAD_REQUEST);
        }
        request.setEntityStream(new ByteArrayInputStream(entity));

        return RequestDetails.builder(request.getMethod(), request.getRequestUri().getRawPath())
                .withContentType(contentType)
                .withDate(request.getHeaderString(DATE_HEADER))
                .withParams(entity.length == 0 ? null : parseBody(contentType, entity))
                .build();
    }

    /**
     * JSON media types are parsed, form bodies become an object of strings, anything else is
     * taken as an already serialized string. A JSON body that does not parse is also taken as a
     * string, so a body-less method still verifies whatever entity it carries.
     *
     * @throws WebApplicationException with status 400 if the body is not valid UTF-8
     */
    public static BodyValue parseBody(String contentType, byte[] entity)
    {
        String mediaType = Splitter.on(';').split(contentType).iterator().next().trim().toLowerCase(Locale.ROOT);
        if (mediaType.equals("application/json") || mediaType.endsWith("+json")) {
            return parseJson(entity);
        }
        if (mediaType.equals("application/x-www-form-urlencoded")) {
            return parseForm(decodeUtf8(entity));
        }
        return new StringValue(decodeUtf8(entity));
    }

    private static BodyValue parseJson(byte[] entity)
    {
        try {
            return toBodyValue(OBJECT_MAPPER.readTree(entity));
        }
        catch (JsonProcessingException e) {
            log.debug("Request body is not valid JSON, using it verbatim: %s", e.getOriginalMessage());
            return new StringValue(decodeUtf8(entity));
        }
        catch (IOException e) {
            log.debug(e, "Failed to parse request body");
            throw new WebApplicationException(BAD_REQUEST);
        }
    }

    // repeated keys become arrays, keeping the order in which the values were sent
    private static BodyValue parseForm(String form)
    {
        ListMultimap<String, String> values = LinkedListMultimap.create();
        for (String pair : FORM_PAIR_SPLITTER.split(form)) {
            List<String> parts = FORM_VALUE_SPLITTER.splitToList(pair);
            values.put(URLDecoder.decode(parts.get(0), UTF_8), (parts.size() == 2) ? URLDecoder.decode(parts.get(1), UTF_8) : "");
        }

        Map<String, Object> fields = new TreeMap<>(BodyValue.KEY_ORDER);
        for (Map.Entry<String, Collection<String>> entry : values.asMap().entrySet()) {
            Collection<String> entryValues = entry.getValue();
            fields.put(entry.getKey(), (entryValues.size() == 1) ? entryValues.iterator().next() : ImmutableList.copyOf(entryValues));
        }
        return BodyValue.of(fields);
    }

    private static String decodeUtf8(byte[] entity)
    {
        try {
            return UTF_8.newDecoder().decode(ByteBuffer.wrap(entity)).toString();
        }
        catch (CharacterCodingException e) {
            log.debug("Request body is not valid UTF-8");
            throw new WebApplicationException(BAD_REQUEST);
        }
    }

    static BodyValue toBodyValue(JsonNode node)
    {
        if (node.isObject()) {
            SortedMap<String, BodyValue> fields = new TreeMap<>(BodyValue.KEY_ORDER);
            node.fields().forEachRemaining(field -> fields.put(field.getKey(), toBodyValue(field.getValue())));
            return new ObjectValue(fields);
        }
        if (node.isArray()) {
            ImmutableList.Builder<BodyValue> elements = ImmutableList.builder();
            node.elements().forEachRemaining(element -> elements.add(toBodyValue(element)));
            return new ArrayValue(elements.build());
        }
        if (node.isTextual()) {
            return new StringValue(node.textValue());
        }
        if (node.isIntegralNumber()) {
            return new NumberValue(new BigDecimal(node.bigIntegerValue()));
        }
        if (node.isNumber()) {
            return new NumberValue(node.decimalValue());
        }
        if (node.isBoolean()) {
            return new BooleanValue(node.booleanValue());
        }
        if (node.isNull() || node.isMissingNode()) {
            return NullValue.INSTANCE;
        }
        throw new WebApplicationException(BAD_REQUEST);
    }
}
