package com.questrail.webm.view;

import com.questrail.webm.model.Node;
import com.questrail.webm.registry.ElementIds;

import java.util.Optional;
import java.util.OptionalLong;

/**
 * Video settings of a track.
 */
public final class Video extends ElementView
{
    Video(Node node)
    {
        super(node);
    }

    public static Video of(Node node)
    {
        return narrow(node, ElementIds.VIDEO, Video::new);
    }

    /**
     * 0 undetermined, 1 interlaced, 2 progressive.
     */
    public long interlacingFlag()
    {
        return mandatoryUnsigned(ElementIds.FLAG_INTERLACED);
    }

    public OptionalLong stereoMode()
    {
        return optionalUnsigned(ElementIds.STEREO_MODE);
    }

    public OptionalLong alphaMode()
    {
        return optionalUnsigned(ElementIds.ALPHA_MODE);
    }

    public long pixelWidth()
    {
        return mandatoryUnsigned(ElementIds.PIXEL_WIDTH);
    }

    public long pixelHeight()
    {
        return mandatoryUnsigned(ElementIds.PIXEL_HEIGHT);
    }

    public OptionalLong pixelCropBottom()
    {
        return optionalUnsigned(ElementIds.PIXEL_CROP_BOTTOM);
    }

    public OptionalLong pixelCropTop()
    {
        return optionalUnsigned(ElementIds.PIXEL_CROP_TOP);
    }

    public OptionalLong pixelCropLeft()
    {
        return optionalUnsigned(ElementIds.PIXEL_CROP_LEFT);
    }

    public OptionalLong pixelCropRight()
    {
        return optionalUnsigned(ElementIds.PIXEL_CROP_RIGHT);
    }

    public OptionalLong displayWidth()
    {
        return optionalUnsigned(ElementIds.DISPLAY_WIDTH);
    }

    public OptionalLong displayHeight()
    {
        return optionalUnsigned(ElementIds.DISPLAY_HEIGHT);
    }

    public OptionalLong displayUnit()
    {
        return optionalUnsigned(ElementIds.DISPLAY_UNIT);
    }

    public OptionalLong aspectRatioType()
    {
        return optionalUnsigned(ElementIds.ASPECT_RATIO_TYPE);
    }

    public Optional<Projection> projection()
    {
        return optionalView(ElementIds.PROJECTION, Projection::new);
    }
}
