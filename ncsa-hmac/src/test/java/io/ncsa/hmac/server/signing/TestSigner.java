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

import com.google.common.collect.ImmutableMap;
import io.ncsa.hmac.spi.signing.RequestDetails;
import io.ncsa.hmac.spi.signing.SignedRequest;
import io.ncsa.hmac.spi.signing.SigningException;
import io.ncsa.hmac.spi.signing.UnsupportedHashAlgorithmException;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static io.ncsa.hmac.spi.signing.HashAlgorithm.SHA256;
import static io.ncsa.hmac.spi.signing.HashAlgorithm.SHA384;
import static io.ncsa.hmac.spi.signing.HashAlgorithm.SHA512;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class TestSigner
{
    // values taken from a reference implementation using the Ruby OpenSSL gem
    private static final String KEY_ID = "SECRET_KEY_ID";
    private static final String KEY_SECRET = "abcdefghijkl";
    private static final String SHA512_SIGNATURE = "svO1jOUW+3wSVc/rzs4WQSOsWtABji6ppN0AkS++2SNvt6fPPvxonLV5WRgFaqnVc63RNmAndel8e/hxoNB4Pg==";

    private static final Signer SIGNER = new Signer(new Canonicalizer());

    @Test
    public void testKnownSignatures()
    {
        RequestDetails requestDetails = requestDetails("application/json");

        assertThat(SIGNER.signature(requestDetails, KEY_SECRET)).isEqualTo(SHA512_SIGNATURE);
        assertThat(SIGNER.signature(requestDetails, KEY_SECRET, SHA512)).isEqualTo(SHA512_SIGNATURE);
        assertThat(SIGNER.signature(requestDetails, KEY_SECRET, SHA384)).isEqualTo("LkXSygPRNKTuqHxUEzM6iUxLnTW4I4D+G7JxVDHKj1l/7qeb/i9rp8aX+b7eW0YN");
        assertThat(SIGNER.signature(requestDetails, KEY_SECRET, SHA256)).isEqualTo("FzfelqPkbfyA2WK/ANhBB4vlqdXQ5m1h53fELgN5QB4=");
    }

    @Test
    public void testContentTypeVariations()
    {
        assertThat(SIGNER.signature(requestDetails(""), KEY_SECRET))
                .isEqualTo("u8+hRiEYpt+cDoOdx0Lt6Ymmw2bc3iA02l3rVEg9en3WPWEAS1yG9It94ds3/bkQmexnS+dNsQ3km8Ewc5Jj7w==");
        assertThat(SIGNER.signature(requestDetails("multipart/mixed; charset: utf-8"), KEY_SECRET))
                .isEqualTo("/G3kxtRWP81YpO1z2DlhZ8ETDtGmIMGOMXEQ1wmpFygEfYLwHvvFTjyIZ9OMl65IFd73ypeyWf3bPxWZ26swkA==");
    }

    @Test
    public void testSign()
    {
        assertThat(SIGNER.sign(requestDetails("application/json"), KEY_ID, KEY_SECRET))
                .isEqualTo("NCSA.HMAC SECRET_KEY_ID:" + SHA512_SIGNATURE);
        assertThat(SIGNER.sign(requestDetails("application/json"), KEY_ID, KEY_SECRET, SHA512, "Other.Service"))
                .isEqualTo("Other.Service SECRET_KEY_ID:" + SHA512_SIGNATURE);

        SignedRequest signedRequest = SIGNER.signRequest(requestDetails("application/json"), KEY_ID, KEY_SECRET, SHA512, "NCSA.HMAC");
        assertThat(signedRequest.contentDigest()).isEqualTo("ecadfcaf838cc3166d637a196530bd90");
        assertThat(signedRequest.date()).isEqualTo("Fri, 22 Jul 2016");
        assertThat(signedRequest.authorization()).isEqualTo("NCSA.HMAC SECRET_KEY_ID:" + SHA512_SIGNATURE);
    }

    @Test
    public void testDeterminism()
    {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("b", 2);
        first.put("a", ImmutableMap.of("y", "1", "x", "2"));
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("a", ImmutableMap.of("x", "2", "y", "1"));
        second.put("b", 2);

        RequestDetails firstRequest = RequestDetails.builder("POST", "/p").withDate("1234").withParams(first).build();
        RequestDetails secondRequest = RequestDetails.builder("post", "/P").withDate("1234").withParams(second).build();

        String signature = SIGNER.sign(firstRequest, KEY_ID, KEY_SECRET);
        assertThat(SIGNER.sign(firstRequest, KEY_ID, KEY_SECRET)).isEqualTo(signature);
        assertThat(SIGNER.sign(secondRequest, KEY_ID, KEY_SECRET)).isEqualTo(signature);
    }

    @Test
    public void testBodylessMethodIgnoresBody()
    {
        RequestDetails withBody = RequestDetails.builder("GET", "/api/auth")
                .withContentType("application/json")
                .withDate("Fri, 22 Jul 2016")
                .withParams(ImmutableMap.of("abc", "def"))
                .build();

        assertThat(SIGNER.signature(withBody, KEY_SECRET))
                .isEqualTo(SIGNER.signature(withBody.withoutParams(), KEY_SECRET))
                .isEqualTo("6zMj3bvxSlvIS6/HPxtbQuJtfOWE7acS3mxwhg4phVe7enFpdVp8nnHassX13/yw2Sh7U7mOV1A+ILIepunOpQ==");
    }

    @Test
    public void testMissingKeyId()
    {
        RequestDetails requestDetails = requestDetails("application/json");
        assertThatThrownBy(() -> SIGNER.sign(requestDetails, null, KEY_SECRET))
                .isInstanceOf(SigningException.class)
                .hasMessage("key_id is required");
        assertThatThrownBy(() -> SIGNER.sign(requestDetails, "", KEY_SECRET))
                .isInstanceOf(SigningException.class)
                .hasMessage("key_id is required");

        // key_id is checked first
        assertThatThrownBy(() -> SIGNER.sign(requestDetails, "", ""))
                .isInstanceOfSatisfying(SigningException.class, e -> assertThat(e.getFieldName()).isEqualTo("key_id"));
    }

    @Test
    public void testMissingKeySecret()
    {
        RequestDetails requestDetails = requestDetails("application/json");
        assertThatThrownBy(() -> SIGNER.sign(requestDetails, KEY_ID, null))
                .isInstanceOf(SigningException.class)
                .hasMessage("key_secret is required");
        assertThatThrownBy(() -> SIGNER.sign(requestDetails, KEY_ID, ""))
                .isInstanceOf(SigningException.class)
                .hasMessage("key_secret is required");
        assertThatThrownBy(() -> SIGNER.signature(requestDetails, ""))
                .isInstanceOf(SigningException.class)
                .hasMessage("key_secret is required");
    }

    @Test
    public void testUnsupportedAlgorithm()
    {
        assertThatThrownBy(() -> new SigningConfig().setHashAlgorithm("md5"))
                .isInstanceOf(UnsupportedHashAlgorithmException.class)
                .hasMessage("Unsupported hash algorithm: md5");
    }

    private static RequestDetails requestDetails(String contentType)
    {
        return RequestDetails.builder("POST", "/api/auth")
                .withContentType(contentType)
                .withDate("Fri, 22 Jul 2016")
                .withParams(ImmutableMap.of("abc", "def"))
                .build();
    }
}
