package io.webber.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.webber.application.port.IconFetcher;
import io.webber.domain.icon.IconSource;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class IconResolverTest {

  @Test
  void blankUrlUsesBundledSvgWithoutFetching() throws Exception {
    List<URI> fetched = new ArrayList<>();
    IconResolver resolver = new IconResolver(uri -> {
      fetched.add(uri);
      return new byte[0];
    });

    IconResolver.ResolvedIcon icon = resolver.resolve("");

    assertSame(IconSource.Bundled.INSTANCE, icon.source());
    assertEquals("icon.svg", icon.fileName());
    assertTrue(new String(icon.bytes(), StandardCharsets.UTF_8).contains("<svg"));
    assertTrue(fetched.isEmpty());
  }

  @Test
  void extensionlessUrlUsesBundledIcon() throws Exception {
    IconFetcher failing = uri -> {
      throw new IOException("should not fetch");
    };

    IconResolver.ResolvedIcon icon = new IconResolver(failing).resolve("https://example.com/favicon");

    assertEquals("icon.svg", icon.fileName());
  }

  @Test
  void remoteIconBytesAreKeptVerbatim() throws Exception {
    byte[] png = {(byte) 0x89, 'P', 'N', 'G', 0, 1, 2};
    List<URI> fetched = new ArrayList<>();
    IconResolver resolver = new IconResolver(uri -> {
      fetched.add(uri);
      return png;
    });

    IconResolver.ResolvedIcon icon = resolver.resolve("https://example.com/logo.png");

    assertEquals("icon.png", icon.fileName());
    assertArrayEquals(png, icon.bytes());
    assertEquals(List.of(URI.create("https://example.com/logo.png")), fetched);
  }

  @Test
  void fetchFailureIsNetworkError() {
    IOException cause = new IOException("HTTP 404 for https://example.com/logo.png");
    IconResolver resolver = new IconResolver(uri -> {
      throw cause;
    });

    PackageBuildException ex =
        assertThrows(PackageBuildException.class, () -> resolver.resolve("https://example.com/logo.png"));

    assertEquals(PackageBuildException.Kind.NETWORK, ex.kind());
    assertEquals("icon.fetch", ex.operation());
    assertSame(cause, ex.getCause());
  }
}
