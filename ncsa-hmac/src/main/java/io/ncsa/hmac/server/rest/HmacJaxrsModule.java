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

import com.google.inject.Binder;
import io.airlift.configuration.AbstractConfigurationAwareModule;
import io.airlift.log.Logger;

import static com.google.inject.multibindings.OptionalBinder.newOptionalBinder;
import static io.airlift.jaxrs.JaxrsBinder.jaxrsBinder;

public class HmacJaxrsModule
        extends AbstractConfigurationAwareModule
{
    private static final Logger log = Logger.get(HmacJaxrsModule.class);

    @Override
    protected void setup(Binder binder)
    {
        newOptionalBinder(binder, AuthenticationFailureHandler.class).setDefault().toProvider(() -> {
            log.info("Using default %s that answers 401 Unauthorized", AuthenticationFailureHandler.class.getSimpleName());
            return AuthenticationFailureHandler.DEFAULT;
        });

        jaxrsBinder(binder).bind(ResourceSecurityDynamicFeature.class);
    }
}
