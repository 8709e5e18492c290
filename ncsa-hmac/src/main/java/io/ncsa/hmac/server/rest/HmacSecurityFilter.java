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

import io.airlift.log.Logger;
import io.ncsa.hmac.spi.signing.RequestAuthorization;
import io.ncsa.hmac.spi.signing.RequestDetails;
import io.ncsa.hmac.spi.signing.SigningController;
import io.ncsa.hmac.spi.signing.VerificationResult;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import org.glassfish.jersey.server.ContainerRequest;

import static io.ncsa.hmac.spi.rest.RequestAdapter.AUTHORIZATION_HEADER;
import static jakarta.ws.rs.core.Response.Status.INTERNAL_SERVER_ERROR;
import static java.util.Objects.requireNonNull;

public class HmacSecurityFilter
        implements ContainerRequestFilter
{
    private static final Logger log = Logger.get(HmacSecurityFilter.class);

    // request property holding the key id of an authenticated request
    public static final String AUTHENTICATED_KEY_ID = HmacSecurityFilter.class.getName() + ".keyId";

    private final SigningController signingController;
    private final AuthenticationFailureHandler authenticationFailureHandler;

    public HmacSecurityFilter(SigningController signingController, AuthenticationFailureHandler authenticationFailureHandler)
    {
        this.signingController = requireNonNull(signingController, "signingController is null");
        this.authenticationFailureHandler = requireNonNull(authenticationFailureHandler, "authenticationFailureHandler is null");
    }

    @Override
    public void filter(ContainerRequestContext requestContext)
    {
        if (!(requestContext.getRequest() instanceof ContainerRequest containerRequest)) {
            log.warn("%s is not a ContainerRequest", requestContext.getRequest().getClass().getName());
            throw new WebApplicationException(INTERNAL_SERVER_ERROR);
        }

        RequestDetails requestDetails = RequestDetailsBuilder.fromRequest(containerRequest);
        RequestAuthorization requestAuthorization = RequestAuthorization.parse(containerRequest.getHeaderString(AUTHORIZATION_HEADER));

        VerificationResult verificationResult = signingController.validateAuthorization(requestDetails, requestAuthorization);
        if (verificationResult.isAuthenticated()) {
            containerRequest.setProperty(AUTHENTICATED_KEY_ID, requestAuthorization.keyId());
            return;
        }

        log.debug("Request %s %s failed authentication: %s", requestDetails.method(), requestDetails.path(), verificationResult);
        authenticationFailureHandler.handleAuthenticationFailure(requestContext, verificationResult);
    }
}
