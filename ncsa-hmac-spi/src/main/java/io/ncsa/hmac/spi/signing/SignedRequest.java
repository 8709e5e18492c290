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
package io.ncsa.hmac.spi.signing;

import static java.util.Objects.requireNonNull;

/**
 * Header values produced by signing a request. {@code date} is the date the signature was
 * computed over, which differs from the request's own date only when none was supplied.
 */
public record SignedRequest(RequestAuthorization requestAuthorization, String contentDigest, String date)
{
    public SignedRequest
    {
        requireNonNull(requestAuthorization, "requestAuthorization is null");
        requireNonNull(contentDigest, "contentDigest is null");
        requireNonNull(date, "date is null");
    }

    public String authorization()
    {
        return requestAuthorization.authorization();
    }
}
