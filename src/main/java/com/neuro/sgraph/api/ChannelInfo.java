package com.neuro.sgraph.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Immutable descriptor of the channels a source emits.
 *
 * This is the one structural fact every node below a source is allowed to
 * assume: how many channels there are, what they are called, what kind of
 * sensor each one is, which ones are known to be bad, and how fast they are
 * sampled. Blocks flowing through the pipeline are laid out channels x time in
 * the order given here.
 *
 * Instances are built with {@link #builder()} and never change afterwards;
 * derived descriptors are produced by the {@code with*} methods.
 */
@EqualsAndHashCode
@ToString
public final class ChannelInfo {
    private final List<String> channelNames;
    private final List<ChannelType> channelTypes;
    private final double samplingRate;
    private final Set<String> badChannels;

    private ChannelInfo(List<String> channelNames, List<ChannelType> channelTypes, double samplingRate,
            Set<String> badChannels) {
        this.channelNames = List.copyOf(channelNames);
        this.channelTypes = List.copyOf(channelTypes);
        this.samplingRate = samplingRate;
        this.badChannels = Collections.unmodifiableSet(new LinkedHashSet<>(badChannels));
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Shorthand for a descriptor whose channels are all of one type. */
    public static ChannelInfo of(double samplingRate, ChannelType type, String... names) {
        Builder b = builder().samplingRate(samplingRate);
        for (String name : names)
            b.channel(name, type);
        return b.build();
    }

    public List<String> channelNames() {
        return channelNames;
    }

    public List<ChannelType> channelTypes() {
        return channelTypes;
    }

    public int channelCount() {
        return channelNames.size();
    }

    public double samplingRate() {
        return samplingRate;
    }

    public Set<String> badChannels() {
        return badChannels;
    }

    public int indexOf(String channelName) {
        return channelNames.indexOf(channelName);
    }

    /** Returns a copy with the given channels added to the bad-channel markers. */
    public ChannelInfo withBadChannels(Set<String> moreBads) {
        Set<String> bads = new LinkedHashSet<>(badChannels);
        bads.addAll(moreBads);
        return new ChannelInfo(channelNames, channelTypes, samplingRate, bads);
    }

    public ChannelInfo withSamplingRate(double newRate) {
        return new ChannelInfo(channelNames, channelTypes, newRate, badChannels);
    }

    /**
     * Verifies the descriptor is internally consistent.
     *
     * @throws NodeValidationException describing the first inconsistency found.
     */
    public void checkConsistency() {
        if (channelNames.isEmpty())
            throw new NodeValidationException("Channel descriptor has 0 channels");
        if (channelNames.size() != channelTypes.size())
            throw new NodeValidationException("Channel descriptor lists " + channelNames.size()
                    + " names but " + channelTypes.size() + " types");
        if (!Double.isFinite(samplingRate) || samplingRate <= 0)
            throw new NodeValidationException("Sampling rate must be a positive number, got " + samplingRate);

        Set<String> seen = new HashSet<>();
        for (String name : channelNames) {
            if (name.isEmpty())
                throw new NodeValidationException("Channel descriptor contains an unnamed channel");
            if (!seen.add(name))
                throw new NodeValidationException("Duplicate channel name: " + name);
        }
        for (String bad : badChannels) {
            if (!seen.contains(bad))
                throw new NodeValidationException("Bad channel " + bad + " is not one of the channels");
        }
        if (channelTypes.stream().noneMatch(ChannelType::isDataChannel))
            throw new NodeValidationException("Channel descriptor has no channels of types EEG, GRAD or MAG");
    }

    /** Fluent builder; validation happens in {@link #checkConsistency()}, not here. */
    public static final class Builder {
        private final List<String> names = new ArrayList<>();
        private final List<ChannelType> types = new ArrayList<>();
        private final Set<String> bads = new LinkedHashSet<>();
        private double samplingRate = Double.NaN;

        private Builder() {
        }

        public Builder channel(String name, ChannelType type) {
            names.add(name);
            types.add(type);
            return this;
        }

        public Builder samplingRate(double samplingRate) {
            this.samplingRate = samplingRate;
            return this;
        }

        public Builder bad(String name) {
            bads.add(name);
            return this;
        }

        public ChannelInfo build() {
            return new ChannelInfo(names, types, samplingRate, bads);
        }
    }
}
