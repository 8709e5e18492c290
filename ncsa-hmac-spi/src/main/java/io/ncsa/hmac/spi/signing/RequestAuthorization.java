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
package io.ncsa.hmac.spi.signing;

import com.google.common.base.Splitter;

import java.util.List;

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

/**
 * The authorization credential carried by a signed request, serialized as
 * {@code "<serviceName> <keyId>:<signature>"}.
 */
public record RequestAuthorization(String serviceName, String keyId, String signature)
{
    public static final String DEFAULT_SERVICE_NAME = "NCSA.HMAC";
    public static final RequestAuthorization INVALID = new RequestAuthorization("", "", "");

    public RequestAuthorization
    {
        requireNonNull(serviceName, "serviceName is null");
        requireNonNull(keyId, "keyId is null");
        requireNonNull(signature, "signature is null");
    }

    public boolean isValid()
    {
        return !serviceName.isEmpty() && !keyId.isEmpty() && !signature.isEmpty();
    }

    public String authorization()
    {
        checkState(isValid(), "authorization cannot be computed for an invalid credential");

        return "%s %s:%s".formatted(serviceName, keyId, signature);
    }

    public static RequestAuthorization parse(String authorization)
    {
        if ((authorization == null) || authorization.isBlank()) {
            return INVALID;
        }

        String trimmed = authorization.trim();
        int separator = trimmed.lastIndexOf(' ');
        if (separator < 0) {
            return INVALID;
        }

        String serviceName = trimmed.substring(0, separator).trim();
        List<String> credential = Splitter.on(':').limit(2).splitToList(trimmed.substring(separator + 1));
        if (credential.size() != 2) {
            return INVALID;
        }

        RequestAuthorization requestAuthorization = new RequestAuthorization(serviceName, credential.get(0), credential.get(1));
        return requestAuthorization.isValid() ? requestAuthorization : INVALID;
    }
}
