package io.imagerollout.models;

import io.imagerollout.enums.EntityKind;

/**
 * Common view over the desktops an inventory pass returns.
 * The disk image is resolved after listing, so it is the only mutable attribute.
 */
public interface DesktopEntity {

    /**
     * Broker identifier used for live lookups of this entity.
     */
    String getId();

    /**
     * Host name the disk image query is sent to.
     */
    String getDnsName();

    String getMachineName();

    String getDesktopGroup();

    String getSiteId();

    void setSiteId(String siteId);

    String getEndpoint();

    void setEndpoint(String endpoint);

    String getDiskImage();

    void setDiskImage(String diskImage);

    EntityKind getKind();
}
