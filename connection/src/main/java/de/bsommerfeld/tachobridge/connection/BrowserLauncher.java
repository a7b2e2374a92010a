package de.bsommerfeld.tachobridge.connection;

import java.io.IOException;
import java.net.URI;

/**
 * Opens a page in the user's browser. Abstracted so the authorization flow
 * runs headless in tests.
 */
public interface BrowserLauncher {

    void open(URI uri) throws IOException;
}
