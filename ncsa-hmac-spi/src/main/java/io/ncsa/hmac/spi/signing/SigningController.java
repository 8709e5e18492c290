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

import io.ncsa.hmac.spi.credentials.SigningKey;

public interface SigningController
{
    /**
     * Sign a request with the configured hash algorithm and service name.
     *
     * @throws SigningException if the key id or key secret is empty
     */
    SignedRequest signRequest(RequestDetails requestDetails, SigningKey signingKey);

    /**
     * Recompute the signature of an inbound request and compare it with the one it carries.
     * Failures are reported as a result, never thrown.
     */
    VerificationResult validateAuthorization(RequestDetails requestDetails, RequestAuthorization requestAuthorization);
}
