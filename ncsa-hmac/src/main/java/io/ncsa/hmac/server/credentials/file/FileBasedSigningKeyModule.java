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
package io.ncsa.hmac.server.credentials.file;

import com.google.inject.Binder;
import io.airlift.configuration.AbstractConfigurationAwareModule;
import io.ncsa.hmac.spi.credentials.SigningKey;

import static io.airlift.configuration.ConfigBinder.configBinder;
import static io.airlift.json.JsonCodecBinder.jsonCodecBinder;
import static io.ncsa.hmac.server.credentials.SigningKeyModule.signingKeyProviderModule;

public class FileBasedSigningKeyModule
        extends AbstractConfigurationAwareModule
{
    // set as config value for "signing-key-provider.type"
    public static final String FILE_BASED_SIGNING_KEYS_IDENTIFIER = "file";

    @Override
    protected void setup(Binder binder)
    {
        install(signingKeyProviderModule(
                FILE_BASED_SIGNING_KEYS_IDENTIFIER,
                FileBasedSigningKeyProvider.class,
                innerBinder -> {
                    configBinder(innerBinder).bindConfig(FileBasedSigningKeyProviderConfig.class);
                    innerBinder.bind(FileBasedSigningKeyProvider.class);
                    jsonCodecBinder(innerBinder).bindListJsonCodec(SigningKey.class);
                }));
    }
}
