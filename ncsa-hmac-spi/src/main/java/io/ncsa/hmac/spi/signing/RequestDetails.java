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

import io.ncsa.hmac.spi.body.BodyValue;

import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Immutable snapshot of the request fields that take part in a signature. Once a snapshot has
 * been taken nothing is read back from the originating request.
 */
public record RequestDetails(String method, String contentType, String path, Optional<String> date, Optional<BodyValue> params)
{
    public RequestDetails
    {
        requireNonNull(method, "method is null");
        requireNonNull(contentType, "contentType is null");
        requireNonNull(path, "path is null");
        requireNonNull(date, "date is null");
        requireNonNull(params, "params is null");
    }

    public RequestDetails withDate(String date)
    {
        return new RequestDetails(method, contentType, path, Optional.of(date), params);
    }

    public RequestDetails withoutParams()
    {
        return new RequestDetails(method, contentType, path, date, Optional.empty());
    }

    public static Builder builder(String method, String path)
    {
        return new Builder(method, path);
    }

    public static class Builder
    {
        private final String method;
        private final String path;
        private String contentType = "";
        private Optional<String> date = Optional.empty();
        private Optional<BodyValue> params = Optional.empty();

        private Builder(String method, String path)
        {
            this.method = requireNonNull(method, "method is null");
            this.path = requireNonNull(path, "path is null");
        }

        public Builder withContentType(String contentType)
        {
            this.contentType = (contentType == null) ? "" : contentType;
            return this;
        }

        public Builder withDate(String date)
        {
            this.date = Optional.ofNullable(date);
            return this;
        }

        public Builder withParams(Object params)
        {
            this.params = Optional.ofNullable(params).map(BodyValue::of);
            return this;
        }

        public RequestDetails build()
        {
            return new RequestDetails(method, contentType, path, date, params);
        }
    }
}
