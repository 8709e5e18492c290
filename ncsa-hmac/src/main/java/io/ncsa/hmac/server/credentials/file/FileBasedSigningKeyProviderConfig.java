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

import io.airlift.configuration.Config;
import io.airlift.configuration.ConfigDescription;
import io.airlift.configuration.validation.FileExists;
import jakarta.validation.constraints.NotNull;

import java.io.File;

public class FileBasedSigningKeyProviderConfig
{
    private File keysFile;

    @NotNull
    @FileExists
    public File getKeysFile()
    {
        return keysFile;
    }

    @Config("signing-key-provider.keys-file-path")
    @ConfigDescription("JSON file holding an array of {\"keyId\", \"keySecret\"} objects")
    public FileBasedSigningKeyProviderConfig setKeysFile(File keysFile)
    {
        this.keysFile = keysFile;
        return this;
    }
}
