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
package io.ncsa.hmac.server.signing;

import com.google.inject.Binder;
import com.google.inject.Scopes;
import io.airlift.configuration.AbstractConfigurationAwareModule;
import io.airlift.log.Logger;
import io.ncsa.hmac.spi.signing.SigningController;

import java.time.Clock;

import static com.google.inject.multibindings.OptionalBinder.newOptionalBinder;
import static io.airlift.configuration.ConfigBinder.configBinder;

public class SigningModule
        extends AbstractConfigurationAwareModule
{
    private static final Logger log = Logger.get(SigningModule.class);

    @Override
    protected void setup(Binder binder)
    {
        configBinder(binder).bindConfig(SigningConfig.class);

        newOptionalBinder(binder, Clock.class).setDefault().toProvider(() -> {
            log.info("Using default system UTC clock for request dates");
            return Clock.systemUTC();
        });

        binder.bind(SigningController.class).to(InternalSigningController.class).in(Scopes.SINGLETON);
    }
}
