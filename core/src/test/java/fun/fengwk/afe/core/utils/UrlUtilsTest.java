package fun.fengwk.afe.core.utils;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class UrlUtilsTest {

    @Test
    public void shouldExtractLowerCasedHostname() {
        assertThat(UrlUtils.extractHostname("https://Docs.Example.COM/a?b=1")).isEqualTo("docs.example.com");
    }

    @Test
    public void shouldReturnNullForMalformedUrl() {
        assertThat(UrlUtils.extractHostname("not a url")).isNull();
        assertThat(UrlUtils.extractHostname(null)).isNull();
        assertThat(UrlUtils.tryParse("http://")).isNull();
    }

    @Test
    public void shouldAcceptBareHostKeysLeniently() {
        assertThat(UrlUtils.extractHostnameLenient("example.com/path")).isEqualTo("example.com");
        assertThat(UrlUtils.extractHostnameLenient("https://a.example.com")).isEqualTo("a.example.com");
    }

    @Test
    public void shouldMatchSameOrSubdomain() {
        assertThat(UrlUtils.isSameOrSubdomain("example.com", "example.com")).isTrue();
        assertThat(UrlUtils.isSameOrSubdomain("api.example.com", "example.com")).isTrue();
        assertThat(UrlUtils.isSameOrSubdomain("notexample.com", "example.com")).isFalse();
    }

}
