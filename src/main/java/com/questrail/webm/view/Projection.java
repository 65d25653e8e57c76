package com.questrail.webm.view;

import com.questrail.webm.model.Node;
import com.questrail.webm.registry.ElementIds;

import java.util.Optional;

/**
 * Spherical video projection. Pose angles are in degrees.
 */
public final class Projection extends ElementView
{
    Projection(Node node)
    {
        super(node);
    }

    public static Projection of(Node node)
    {
        return narrow(node, ElementIds.PROJECTION, Projection::new);
    }

    public long type()
    {
        return mandatoryUnsigned(ElementIds.PROJECTION_TYPE);
    }

    public Optional<byte[]> privateData()
    {
        return optionalBinary(ElementIds.PROJECTION_PRIVATE);
    }

    public double poseYaw()
    {
        return mandatoryFloat(ElementIds.PROJECTION_POSE_YAW);
    }

    public double posePitch()
    {
        return mandatoryFloat(ElementIds.PROJECTION_POSE_PITCH);
    }

    public double poseRoll()
    {
        return mandatoryFloat(ElementIds.PROJECTION_POSE_ROLL);
    }
}
