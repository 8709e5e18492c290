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

import com.google.common.hash.Hashing;
import io.ncsa.hmac.spi.body.BodyValue;
import io.ncsa.hmac.spi.body.BodyValue.StringValue;

import java.util.Optional;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * MD5 digest of a request body, rendered as 32 lower-case hex characters. An absent body and an
 * empty object both digest to the empty string.
 */
public final class ContentDigest
{
    public static final String EMPTY_DIGEST = "";

    private ContentDigest() {}

    @SuppressWarnings("deprecation")
    public static String contentDigest(Optional<BodyValue> body)
    {
        if (body.isEmpty() || body.get().isEmptyBody()) {
            return EMPTY_DIGEST;
        }
        return Hashing.md5().hashBytes(encodedBody(body.get())).toString();
    }

    public static String contentDigest(BodyValue body)
    {
        return contentDigest(Optional.of(body));
    }

    // a top level string has already been serialized by the caller
    static byte[] encodedBody(BodyValue body)
    {
        if (body instanceof StringValue stringValue) {
            return stringValue.value().getBytes(UTF_8);
        }
        return CanonicalBodyEncoder.encode(body);
    }
}
