package io.webber.domain.content;

import static org.junit.jupiter.api.Assertions.assertEquals;

import io.webber.domain.pkg.PackageRequest;
import org.junit.jupiter.api.Test;

class DataFilesTest {

  @Test
  void apparmorPolicyWritesVersionAsNumber() {
    assertEquals("""
        {
            "template": "ubuntu-webapp",
            "policy_groups": [
                "networking",
                "webview"
            ],
            "policy_version": 16.04
        }
        """, DataFiles.apparmor());
  }

  @Test
  void desktopEntryLaunchesWebappContainer() {
    PackageRequest request = new PackageRequest(
        "https://example.com/app", "Example App", "#336699", "", "https?://example.com/*");

    assertEquals("""
        [Desktop Entry]
        Name=Example App
        Exec=webapp-container --webappUrlPatterns=https?://example.com/* --store-session-cookies https://example.com/app
        Icon=icon.png
        Terminal=false
        Type=Application
        X-Ubuntu-Touch=true
        X-Ubuntu-Splash-Color=#336699
        """, DataFiles.desktop(request, "icon.png"));
  }

  @Test
  void desktopEntryEmbedsValuesVerbatim() {
    PackageRequest request = new PackageRequest("u", "", "not-a-color", "", "");

    assertEquals("""
        [Desktop Entry]
        Name=
        Exec=webapp-container --webappUrlPatterns= --store-session-cookies u
        Icon=icon.svg
        Terminal=false
        Type=Application
        X-Ubuntu-Touch=true
        X-Ubuntu-Splash-Color=not-a-color
        """, DataFiles.desktop(request, "icon.svg"));
  }
}
