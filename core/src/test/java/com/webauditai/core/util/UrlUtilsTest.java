package com.webauditai.core.util;

import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.junit.jupiter.api.Assertions.*;

class UrlUtilsTest {

    @Test
    void default_scheme() {
        assertEquals("https://example.com/a", UrlUtils.withDefaultScheme(" example.com/a "));
        assertEquals("http://example.com", UrlUtils.withDefaultScheme("http://example.com"));
        assertEquals("", UrlUtils.withDefaultScheme("  "));
        assertNull(UrlUtils.withDefaultScheme(null));
    }

    @Test
    void host_port_gets_default_scheme() {
        assertEquals("https://example.com:8080/a", UrlUtils.withDefaultScheme("example.com:8080/a"));
        assertEquals("https://localhost:3000", UrlUtils.withDefaultScheme("localhost:3000"));
    }

    @Test
    void other_schemes_are_left_for_the_caller() {
        assertEquals("mailto:admin@intranet.local", UrlUtils.withDefaultScheme("mailto:admin@intranet.local"));
        assertEquals("javascript:alert(1)", UrlUtils.withDefaultScheme("javascript:alert(1)"));
        assertEquals("file:///etc/passwd", UrlUtils.withDefaultScheme("file:///etc/passwd"));
    }

    @Test
    void display_domain_strips_only_leading_www() {
        assertEquals("example.com", UrlUtils.displayDomain("https://www.example.com/x"));
        assertEquals("example.com:8080", UrlUtils.displayDomain("https://WWW.example.com:8080/"));
        assertEquals("blog.www.example.com", UrlUtils.displayDomain("https://blog.www.example.com"));
        assertEquals("", UrlUtils.displayDomain("not a url"));
        assertEquals("", UrlUtils.displayDomain(null));
    }

    @Test
    void origin() {
        URI a = URI.create("HTTPS://Example.com:443/a?q=1");
        assertEquals("https://Example.com:443", UrlUtils.origin(a));
        assertNull(UrlUtils.origin(URI.create("/relative")));
    }

    @Test
    void path_of() {
        assertEquals("/a/b", UrlUtils.pathOf("https://example.com/a/b?x=1"));
        assertEquals("", UrlUtils.pathOf("https://example.com"));
        assertEquals("", UrlUtils.pathOf("bad url"));
    }
}
