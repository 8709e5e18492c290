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

import io.ncsa.hmac.spi.signing.VerificationResult;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.container.ContainerRequestContext;

import static jakarta.ws.rs.core.Response.Status.UNAUTHORIZED;

/**
 * Invoked when an inbound request fails verification. Implementations must either throw or
 * abort the request. Every outcome other than {@link VerificationResult#AUTHENTICATED} is passed
 * here, so the default answers them all with the same 401.
 */
public interface AuthenticationFailureHandler
{
    AuthenticationFailureHandler DEFAULT = (requestContext, verificationResult) -> {
        throw new WebApplicationException(UNAUTHORIZED);
    };

    void handleAuthenticationFailure(ContainerRequestContext requestContext, VerificationResult verificationResult);
}
