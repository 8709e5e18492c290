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
package io.ncsa.hmac.server;

import com.google.inject.Binder;
import com.google.inject.Scopes;
import io.airlift.configuration.AbstractConfigurationAwareModule;
import io.ncsa.hmac.server.client.HmacRequestSigner;
import io.ncsa.hmac.server.credentials.SigningKeyModule;
import io.ncsa.hmac.server.credentials.file.FileBasedSigningKeyModule;
import io.ncsa.hmac.server.rest.HmacJaxrsModule;
import io.ncsa.hmac.server.signing.SigningModule;

/**
 * Signing, verification and both request bindings. Expects {@code JsonModule} to be installed
 * alongside it, and {@code JaxrsModule} when resources are served.
 */
public class NcsaHmacModule
        extends AbstractConfigurationAwareModule
{
    @Override
    protected void setup(Binder binder)
    {
        install(new SigningModule());
        install(new SigningKeyModule());
        install(new HmacJaxrsModule());

        binder.bind(HmacRequestSigner.class).in(Scopes.SINGLETON);

        // provided implementations
        install(new FileBasedSigningKeyModule());
    }
}
