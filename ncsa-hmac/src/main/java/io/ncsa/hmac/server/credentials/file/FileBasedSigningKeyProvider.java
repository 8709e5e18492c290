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

import com.google.common.collect.ImmutableMap;
import com.google.common.io.Files;
import com.google.inject.Inject;
import io.airlift.json.JsonCodec;
import io.airlift.log.Logger;
import io.ncsa.hmac.spi.credentials.SigningKey;
import io.ncsa.hmac.spi.credentials.SigningKeyProvider;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Signing keys read once from a JSON array of {@code {"keyId": ..., "keySecret": ...}} objects.
 * Empty ids or secrets and repeated ids fail at startup rather than on the first request.
 */
public class FileBasedSigningKeyProvider
        implements SigningKeyProvider
{
    private static final Logger log = Logger.get(FileBasedSigningKeyProvider.class);

    private final Map<String, SigningKey> signingKeys;

    @Inject
    public FileBasedSigningKeyProvider(FileBasedSigningKeyProviderConfig config, JsonCodec<List<SigningKey>> jsonCodec)
    {
        requireNonNull(config, "config is null");
        requireNonNull(jsonCodec, "jsonCodec is null");

        File keysFile = config.getKeysFile();
        this.signingKeys = indexByKeyId(keysFile, readSigningKeys(keysFile, jsonCodec));
        log.info("Loaded %s signing keys from %s", signingKeys.size(), keysFile);
    }

    private static List<SigningKey> readSigningKeys(File keysFile, JsonCodec<List<SigningKey>> jsonCodec)
    {
        try {
            return jsonCodec.fromJson(Files.toByteArray(keysFile));
        }
        catch (IOException e) {
            throw new UncheckedIOException("Failed to read signing keys file", e);
        }
    }

    private static Map<String, SigningKey> indexByKeyId(File keysFile, List<SigningKey> signingKeyList)
    {
        Map<String, SigningKey> byKeyId = new HashMap<>();
        for (SigningKey signingKey : signingKeyList) {
            checkArgument(!signingKey.keyId().isEmpty(), "Signing key with an empty keyId in %s", keysFile);
            checkArgument(!signingKey.keySecret().isEmpty(), "Signing key %s has an empty keySecret in %s", signingKey.keyId(), keysFile);
            checkArgument(byKeyId.putIfAbsent(signingKey.keyId(), signingKey) == null, "Duplicate signing key id %s in %s", signingKey.keyId(), keysFile);
        }
        return ImmutableMap.copyOf(byKeyId);
    }

    @Override
    public Optional<SigningKey> signingKey(String keyId)
    {
        return Optional.ofNullable(signingKeys.get(keyId));
    }
}
