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
package io.ncsa.hmac.spi.timestamps;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

public final class RequestTimestamp
{
    public static final ZoneId ZONE = ZoneId.of("Z");
    private static final DateTimeFormatter REQUEST_DATE_FORMAT = DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSSSSS'Z'", Locale.US).withZone(ZONE);

    public static String toRequestFormat(Instant instant)
    {
        return REQUEST_DATE_FORMAT.format(instant);
    }

    /**
     * Parse an ISO-8601 extended timestamp with an explicit offset or {@code Z} designator.
     *
     * @throws java.time.format.DateTimeParseException if the value is not such a timestamp
     */
    public static Instant fromRequestTimestamp(String requestTimestamp)
    {
        return OffsetDateTime.parse(requestTimestamp).toInstant();
    }

    private RequestTimestamp() {}
}
