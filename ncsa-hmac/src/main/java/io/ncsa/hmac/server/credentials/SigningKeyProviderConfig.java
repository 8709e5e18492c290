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

import io.airlift.configuration.Config;
import io.airlift.configuration.ConfigDescription;

import java.util.Optional;

public class SigningKeyProviderConfig
{
    private Optional<String> pluginIdentifier = Optional.empty();

    public Optional<String> getPluginIdentifier()
    {
        return pluginIdentifier;
    }

    @Config("signing-key-provider.type")
    @ConfigDescription("Identifier of the signing key provider to use. When unset no keys are known")
    public SigningKeyProviderConfig setPluginIdentifier(String pluginIdentifier)
    {
        this.pluginIdentifier = Optional.ofNullable(pluginIdentifier);
        return this;
    }
}
