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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableSet;
import io.ncsa.hmac.spi.body.BodyValue;
import io.ncsa.hmac.spi.signing.RequestDetails;
import io.ncsa.hmac.spi.timestamps.RequestTimestamp;

import java.time.Clock;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

import static com.google.common.collect.ImmutableSet.toImmutableSet;
import static java.util.Objects.requireNonNull;

/**
 * Builds the string that gets signed:
 * <pre>
 * METHOD
 * content-type
 * content-digest
 * date
 * path
 * </pre>
 * The method is upper-cased, the path lower-cased, the other fields are used verbatim.
 */
public class Canonicalizer
{
    public static final Set<String> DEFAULT_BODYLESS_METHODS = ImmutableSet.of("GET");

    private static final Joiner NEWLINE_JOINER = Joiner.on('\n');

    private final Set<String> bodylessMethods;
    private final Clock clock;

    public Canonicalizer()
    {
        this(DEFAULT_BODYLESS_METHODS, Clock.systemUTC());
    }

    public Canonicalizer(Set<String> bodylessMethods, Clock clock)
    {
        this.bodylessMethods = bodylessMethods.stream()
                .map(method -> method.toUpperCase(Locale.ROOT))
                .collect(toImmutableSet());
        this.clock = requireNonNull(clock, "clock is null");
    }

    public record CanonicalRequest(String canonicalString, String contentDigest, String date, boolean dateDefaulted)
    {
        public CanonicalRequest
        {
            requireNonNull(canonicalString, "canonicalString is null");
            requireNonNull(contentDigest, "contentDigest is null");
            requireNonNull(date, "date is null");
        }
    }

    public CanonicalRequest canonicalize(RequestDetails requestDetails)
    {
        String method = requestDetails.method().toUpperCase(Locale.ROOT);

        Optional<String> suppliedDate = requestDetails.date().filter(date -> !date.isEmpty());
        String date = suppliedDate.orElseGet(() -> RequestTimestamp.toRequestFormat(clock.instant()));

        Optional<BodyValue> body = isBodyless(method) ? Optional.empty() : requestDetails.params();
        String contentDigest = ContentDigest.contentDigest(body);

        String canonicalString = NEWLINE_JOINER.join(
                method,
                requestDetails.contentType(),
                contentDigest,
                date,
                requestDetails.path().toLowerCase(Locale.ROOT));

        return new CanonicalRequest(canonicalString, contentDigest, date, suppliedDate.isEmpty());
    }

    public boolean isBodyless(String method)
    {
        return bodylessMethods.contains(method.toUpperCase(Locale.ROOT));
    }
}
