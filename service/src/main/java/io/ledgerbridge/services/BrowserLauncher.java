package io.ledgerbridge.services;

import java.awt.Desktop;
import java.awt.GraphicsEnvironment;
import java.io.IOException;
import java.net.URI;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Opens the authorization page for the user, or logs it where no desktop browser exists. */
@Component
@Slf4j
public class BrowserLauncher {

  public void open(String url) {
    if (GraphicsEnvironment.isHeadless()
        || !Desktop.isDesktopSupported()
        || !Desktop.getDesktop().isSupported(Desktop.Action.BROWSE)) {
      log.info("Open this URL in a browser to authorize: {}", url);
      return;
    }
    try {
      Desktop.getDesktop().browse(URI.create(url));
    } catch (IOException | UnsupportedOperationException e) {
      log.warn("Could not open a browser, open this URL to authorize: {}", url, e);
    }
  }
}
