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
package io.ncsa.hmac.spi.rest;

import io.ncsa.hmac.spi.signing.RequestDetails;
import io.ncsa.hmac.spi.signing.SignedRequest;

/**
 * Binds the signing protocol to a concrete request type.
 *
 * @param <T> the request type
 */
public interface RequestAdapter<T>
{
    String AUTHORIZATION_HEADER = "Authorization";
    String CONTENT_DIGEST_HEADER = "Content-Digest";
    String CONTENT_TYPE_HEADER = "Content-Type";
    String DATE_HEADER = "Date";

    RequestDetails requestDetails(T request);

    /**
     * Return the request with {@code Authorization}, {@code Content-Digest} and {@code Date}
     * set from the signing result.
     */
    T withSignature(T request, SignedRequest signedRequest);
}
