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

import io.ncsa.hmac.server.rest.ResourceSecurity.Hmac;
import io.ncsa.hmac.server.rest.ResourceSecurity.Public;
import io.ncsa.hmac.server.signing.InternalSigningController;
import io.ncsa.hmac.server.signing.SigningConfig;
import io.ncsa.hmac.spi.credentials.SigningKeyProvider;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ResourceInfo;
import jakarta.ws.rs.core.FeatureContext;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class TestResourceSecurityDynamicFeature
{
    private final ResourceSecurityDynamicFeature dynamicFeature = new ResourceSecurityDynamicFeature(
            new InternalSigningController(SigningKeyProvider.NOOP, new SigningConfig(), Clock.systemUTC()),
            AuthenticationFailureHandler.DEFAULT);

    @ResourceSecurity(Hmac.class)
    public static class SignedResource
    {
        public void signed() {}

        @ResourceSecurity(Public.class)
        public void status() {}
    }

    public static class UnannotatedResource
    {
        public void anything() {}
    }

    @Test
    public void testAccessType()
            throws NoSuchMethodException
    {
        assertThat(ResourceSecurityDynamicFeature.getAccessType(resourceInfo(SignedResource.class, "signed"))).isEqualTo(Hmac.class);
        assertThat(ResourceSecurityDynamicFeature.getAccessType(resourceInfo(SignedResource.class, "status"))).isEqualTo(Public.class);
        assertThatThrownBy(() -> ResourceSecurityDynamicFeature.getAccessType(resourceInfo(UnannotatedResource.class, "anything")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("Resource is not annotated with @ResourceSecurity");
    }

    @Test
    public void testFilterRegistration()
            throws NoSuchMethodException
    {
        List<Object[]> registrations = new ArrayList<>();
        FeatureContext featureContext = recordingFeatureContext(registrations);

        dynamicFeature.configure(resourceInfo(SignedResource.class, "status"), featureContext);
        assertThat(registrations).isEmpty();

        dynamicFeature.configure(resourceInfo(SignedResource.class, "signed"), featureContext);
        assertThat(registrations).hasSize(1);
        assertThat(registrations.get(0)[0]).isInstanceOf(HmacSecurityFilter.class);
        assertThat(registrations.get(0)[1]).isEqualTo(Priorities.AUTHENTICATION);
    }

    private static ResourceInfo resourceInfo(Class<?> resourceClass, String methodName)
            throws NoSuchMethodException
    {
        Method method = resourceClass.getMethod(methodName);
        return new ResourceInfo()
        {
            @Override
            public Method getResourceMethod()
            {
                return method;
            }

            @Override
            public Class<?> getResourceClass()
            {
                return resourceClass;
            }
        };
    }

    private static FeatureContext recordingFeatureContext(List<Object[]> registrations)
    {
        return (FeatureContext) Proxy.newProxyInstance(
                FeatureContext.class.getClassLoader(),
                new Class<?>[] {FeatureContext.class},
                (proxy, method, args) -> {
                    if (method.getName().equals("register")) {
                        registrations.add(args);
                        return proxy;
                    }
                    throw new UnsupportedOperationException(method.getName());
                });
    }
}
