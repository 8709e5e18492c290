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
package io.ncsa.hmac.server.credentials;

import com.google.inject.Binder;
import com.google.inject.Module;
import com.google.inject.Scopes;
import io.airlift.configuration.AbstractConfigurationAwareModule;
import io.airlift.log.Logger;
import io.ncsa.hmac.spi.credentials.SigningKeyProvider;

import static com.google.inject.multibindings.OptionalBinder.newOptionalBinder;
import static io.airlift.configuration.ConditionalModule.conditionalModule;
import static io.airlift.configuration.ConfigBinder.configBinder;
import static io.airlift.configuration.ConfigurationAwareModule.combine;

public class SigningKeyModule
        extends AbstractConfigurationAwareModule
{
    private static final Logger log = Logger.get(SigningKeyModule.class);

    @Override
    protected void setup(Binder binder)
    {
        configBinder(binder).bindConfig(SigningKeyProviderConfig.class);
        newOptionalBinder(binder, SigningKeyProvider.class).setDefault().toProvider(() -> {
            log.info("Using default %s NOOP implementation", SigningKeyProvider.class.getSimpleName());
            return SigningKeyProvider.NOOP;
        });
    }

    /**
     * Binds {@code implementationClass} as the {@link SigningKeyProvider} when
     * {@code signing-key-provider.type} equals {@code identifier}. {@code module} is only installed in that case.
     */
    public static Module signingKeyProviderModule(String identifier, Class<? extends SigningKeyProvider> implementationClass, Module module)
    {
        return conditionalModule(SigningKeyProviderConfig.class,
                config -> {
                    log.info("Registered %s implementation %s with conditional identifier \"%s\"", SigningKeyProvider.class.getSimpleName(), implementationClass.getSimpleName(), identifier);
                    return config.getPluginIdentifier().map(identifier::equals).orElse(false);
                },
                combine(
                        binder -> {
                            log.info("Using %s implementation %s with identifier \"%s\"", SigningKeyProvider.class.getSimpleName(), implementationClass.getSimpleName(), identifier);
                            newOptionalBinder(binder, SigningKeyProvider.class).setBinding().to(implementationClass).in(Scopes.SINGLETON);
                        },
                        module));
    }
}
