package de.bsommerfeld.tachobridge.api;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * Description of this installation sent to the Hub when the approved
 * authorization token is exchanged for a device token. The Hub lists it in
 * the user's device overview.
 */
public record DeviceDetails(
        String deviceName,
        String devicePlatform,
        String deviceModel,
        String osVersion,
        String applicationVersion,
        String deviceManufacturer) {

    static final String MANUFACTURER = "Tacho Bridge";

    /** Details of the machine the JVM runs on. */
    public static DeviceDetails current() {
        return new DeviceDetails(
                hostName(),
                System.getProperty("os.name", "unknown"),
                System.getProperty("os.arch", "unknown"),
                System.getProperty("os.version", "unknown"),
                ApplicationVersion.get(),
                MANUFACTURER);
    }

    void writeTo(ObjectNode node) {
        node.put("device_name", deviceName);
        node.put("device_platform", devicePlatform);
        node.put("device_model", deviceModel);
        node.put("os_version", osVersion);
        node.put("application_version", applicationVersion);
        node.put("device_manufacturer", deviceManufacturer);
    }

    private static String hostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return MANUFACTURER + " Desktop";
        }
    }
}
