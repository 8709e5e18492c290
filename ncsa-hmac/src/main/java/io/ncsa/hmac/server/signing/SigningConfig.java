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

import com.google.common.base.Splitter;
import io.airlift.configuration.Config;
import io.airlift.configuration.ConfigDescription;
import io.airlift.units.Duration;
import io.airlift.units.MinDuration;
import io.ncsa.hmac.spi.signing.HashAlgorithm;
import io.ncsa.hmac.spi.signing.RequestAuthorization;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.Locale;
import java.util.Set;

import static com.google.common.collect.ImmutableSet.toImmutableSet;

public class SigningConfig
{
    private HashAlgorithm hashAlgorithm = HashAlgorithm.DEFAULT;
    private String serviceName = RequestAuthorization.DEFAULT_SERVICE_NAME;
    private Set<String> bodylessMethods = Canonicalizer.DEFAULT_BODYLESS_METHODS;
    private Duration maxClockDrift;

    @NotNull
    public HashAlgorithm getHashAlgorithm()
    {
        return hashAlgorithm;
    }

    @Config("hmac.hash-algorithm")
    @ConfigDescription("HMAC variant used to sign and verify requests: SHA256, SHA384 or SHA512")
    public SigningConfig setHashAlgorithm(String hashAlgorithm)
    {
        this.hashAlgorithm = HashAlgorithm.fromName(hashAlgorithm);
        return this;
    }

    @NotEmpty
    public String getServiceName()
    {
        return serviceName;
    }

    @Config("hmac.service-name")
    @ConfigDescription("Service name that prefixes the Authorization header")
    public SigningConfig setServiceName(String serviceName)
    {
        this.serviceName = serviceName;
        return this;
    }

    @NotNull
    public Set<String> getBodylessMethods()
    {
        return bodylessMethods;
    }

    @Config("hmac.bodyless-methods")
    @ConfigDescription("Comma separated HTTP methods whose body is not part of the content digest")
    public SigningConfig setBodylessMethods(String bodylessMethods)
    {
        this.bodylessMethods = Splitter.on(',').trimResults().omitEmptyStrings()
                .splitToStream(bodylessMethods)
                .map(method -> method.toUpperCase(Locale.ROOT))
                .collect(toImmutableSet());
        return this;
    }

    @MinDuration("0s")
    public Duration getMaxClockDrift()
    {
        return maxClockDrift;
    }

    @Config("hmac.max-clock-drift")
    @ConfigDescription("Reject requests whose Date header is further than this from the current time. Disabled when unset")
    public SigningConfig setMaxClockDrift(Duration maxClockDrift)
    {
        this.maxClockDrift = maxClockDrift;
        return this;
    }
}
