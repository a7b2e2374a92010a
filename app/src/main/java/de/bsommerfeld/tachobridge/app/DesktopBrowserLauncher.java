package de.bsommerfeld.tachobridge.app;

import com.google.inject.Singleton;
import de.bsommerfeld.tachobridge.connection.BrowserLauncher;

import java.awt.Desktop;
import java.io.IOException;
import java.net.URI;

/**
 * Opens pages through {@link Desktop}. Headless systems and desktops without
 * a browse action report an {@link IOException}.
 */
@Singleton
public class DesktopBrowserLauncher implements BrowserLauncher {

    @Override
    public void open(URI uri) throws IOException {
        if (!Desktop.isDesktopSupported() || !Desktop.getDesktop().isSupported(Desktop.Action.BROWSE)) {
            throw new IOException("No browser available to open " + uri);
        }
        Desktop.getDesktop().browse(uri);
    }
}
