package com.neuro.sgraph.api;

/** Kind of sensor a channel was recorded from. */
public enum ChannelType {
    EEG(true),
    GRAD(true),
    MAG(true),
    EOG(false),
    ECG(false),
    STIM(false),
    MISC(false);

    private final boolean dataChannel;

    ChannelType(boolean dataChannel) {
        this.dataChannel = dataChannel;
    }

    /** True for the brain-signal channel kinds the processors operate on. */
    public boolean isDataChannel() {
        return dataChannel;
    }

    public static ChannelType fromString(String text) {
        for (ChannelType t : values()) {
            if (t.name().equalsIgnoreCase(text))
                return t;
        }
        throw new NodeValidationException("Unknown channel type: " + text);
    }
}
