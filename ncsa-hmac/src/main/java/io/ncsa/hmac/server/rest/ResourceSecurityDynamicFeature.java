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

import com.google.inject.Inject;
import io.ncsa.hmac.server.rest.ResourceSecurity.AccessType;
import io.ncsa.hmac.server.rest.ResourceSecurity.Hmac;
import io.ncsa.hmac.spi.signing.SigningController;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.DynamicFeature;
import jakarta.ws.rs.container.ResourceInfo;
import jakarta.ws.rs.core.FeatureContext;

import java.lang.reflect.AnnotatedElement;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Registers {@link HmacSecurityFilter} on every resource method declared {@code @ResourceSecurity(Hmac.class)}.
 * A method-level annotation takes precedence over the class-level one.
 */
public class ResourceSecurityDynamicFeature
        implements DynamicFeature
{
    private final SigningController signingController;
    private final AuthenticationFailureHandler authenticationFailureHandler;

    @Inject
    public ResourceSecurityDynamicFeature(SigningController signingController, AuthenticationFailureHandler authenticationFailureHandler)
    {
        this.signingController = requireNonNull(signingController, "signingController is null");
        this.authenticationFailureHandler = requireNonNull(authenticationFailureHandler, "authenticationFailureHandler is null");
    }

    @Override
    public void configure(ResourceInfo resourceInfo, FeatureContext context)
    {
        Class<? extends AccessType> accessType = getAccessType(resourceInfo);
        if (accessType == Hmac.class) {
            context.register(new HmacSecurityFilter(signingController, authenticationFailureHandler), Priorities.AUTHENTICATION);
        }
    }

    static Class<? extends AccessType> getAccessType(ResourceInfo resourceInfo)
    {
        return getAccessTypeFromAnnotation(resourceInfo.getResourceMethod())
                .or(() -> getAccessTypeFromAnnotation(resourceInfo.getResourceClass()))
                .orElseThrow(() -> new IllegalArgumentException("Resource is not annotated with @" + ResourceSecurity.class.getSimpleName() + ": " + resourceInfo.getResourceMethod()));
    }

    private static Optional<Class<? extends AccessType>> getAccessTypeFromAnnotation(AnnotatedElement annotatedElement)
    {
        return Optional.ofNullable(annotatedElement.getAnnotation(ResourceSecurity.class))
                .map(ResourceSecurity::value);
    }
}
