package com.neuro.sgraph.api;

import static org.junit.Assert.*;

import java.util.List;
import java.util.Set;

import org.junit.Test;

public class ChannelInfoTest {

    private static ChannelInfo eeg(String... names) {
        return ChannelInfo.of(250, ChannelType.EEG, names);
    }

    @Test
    public void testBuilder() {
        ChannelInfo info = ChannelInfo.builder()
                .channel("Fz", ChannelType.EEG)
                .channel("VEOG", ChannelType.EOG)
                .samplingRate(500)
                .bad("VEOG")
                .build();
        info.checkConsistency();
        assertEquals(2, info.channelCount());
        assertEquals(List.of("Fz", "VEOG"), info.channelNames());
        assertEquals(ChannelType.EOG, info.channelTypes().get(1));
        assertEquals(500.0, info.samplingRate(), 0.0);
        assertEquals(Set.of("VEOG"), info.badChannels());
        assertEquals(1, info.indexOf("VEOG"));
        assertEquals(-1, info.indexOf("Cz"));
    }

    @Test
    public void testDerivedCopiesLeaveOriginalUntouched() {
        ChannelInfo info = eeg("C3", "C4");
        ChannelInfo withBad = info.withBadChannels(Set.of("C4"));
        assertTrue(info.badChannels().isEmpty());
        assertEquals(Set.of("C4"), withBad.badChannels());
        assertEquals(1000.0, info.withSamplingRate(1000).samplingRate(), 0.0);
        assertEquals(250.0, info.samplingRate(), 0.0);
    }

    @Test
    public void testEquality() {
        assertEquals(eeg("C3", "C4"), eeg("C3", "C4"));
        assertNotEquals(eeg("C3", "C4"), eeg("C4", "C3"));
    }

    @Test
    public void testRejectsEmptyDescriptor() {
        assertInconsistent(ChannelInfo.builder().samplingRate(100).build(), "0 channels");
    }

    @Test
    public void testRejectsBadSamplingRate() {
        assertInconsistent(ChannelInfo.of(0, ChannelType.EEG, "Cz"), "Sampling rate");
        assertInconsistent(ChannelInfo.of(Double.NaN, ChannelType.EEG, "Cz"), "Sampling rate");
        assertInconsistent(ChannelInfo.builder().channel("Cz", ChannelType.EEG).build(), "Sampling rate");
    }

    @Test
    public void testRejectsDuplicateAndEmptyNames() {
        assertInconsistent(eeg("Cz", "Cz"), "Duplicate channel name: Cz");
        assertInconsistent(eeg("Cz", ""), "unnamed");
    }

    @Test
    public void testRejectsUnknownBadChannel() {
        assertInconsistent(eeg("Cz").withBadChannels(Set.of("Pz")), "Bad channel Pz");
    }

    @Test
    public void testRejectsDescriptorWithoutDataChannels() {
        assertInconsistent(ChannelInfo.of(100, ChannelType.STIM, "STI 014"), "no channels of types");
    }

    @Test
    public void testChannelTypeFromString() {
        assertEquals(ChannelType.GRAD, ChannelType.fromString("grad"));
        assertTrue(ChannelType.MAG.isDataChannel());
        assertFalse(ChannelType.ECG.isDataChannel());
    }

    @Test(expected = NodeValidationException.class)
    public void testUnknownChannelType() {
        ChannelType.fromString("EMG");
    }

    private static void assertInconsistent(ChannelInfo info, String expectedMessagePart) {
        try {
            info.checkConsistency();
            fail("Expected NodeValidationException for " + info);
        } catch (NodeValidationException e) {
            assertTrue(e.getMessage(), e.getMessage().contains(expectedMessagePart));
        }
    }
}
