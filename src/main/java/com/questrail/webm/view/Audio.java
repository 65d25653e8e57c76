package com.questrail.webm.view;

import com.questrail.webm.model.Node;
import com.questrail.webm.registry.ElementIds;

import java.util.OptionalDouble;
import java.util.OptionalLong;

/**
 * Audio settings of a track.
 */
public final class Audio extends ElementView
{
    Audio(Node node)
    {
        super(node);
    }

    public static Audio of(Node node)
    {
        return narrow(node, ElementIds.AUDIO, Audio::new);
    }

    /**
     * Sampling frequency in Hz.
     */
    public double samplingFrequency()
    {
        return mandatoryFloat(ElementIds.SAMPLING_FREQUENCY);
    }

    public OptionalDouble outputSamplingFrequency()
    {
        return optionalFloat(ElementIds.OUTPUT_SAMPLING_FREQUENCY);
    }

    public long numChannels()
    {
        return mandatoryUnsigned(ElementIds.CHANNELS);
    }

    public OptionalLong bitDepth()
    {
        return optionalUnsigned(ElementIds.BIT_DEPTH);
    }
}
