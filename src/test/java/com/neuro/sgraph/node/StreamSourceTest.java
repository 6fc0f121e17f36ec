package com.neuro.sgraph.node;

import static org.junit.Assert.*;

import org.junit.Before;
import org.junit.Test;

import com.neuro.sgraph.api.ChannelInfo;
import com.neuro.sgraph.api.ChannelType;
import com.neuro.sgraph.api.NodeState;
import com.neuro.sgraph.api.NodeValidationException;
import com.neuro.sgraph.api.SignalBlock;

public class StreamSourceTest {

    private static final ChannelInfo TWO = ChannelInfo.of(200, ChannelType.EEG, "C3", "C4");
    private static final ChannelInfo THREE = ChannelInfo.of(200, ChannelType.EEG, "C3", "Cz", "C4");

    private StreamSource source;

    @Before
    public void setUp() {
        source = new StreamSource("eeg", TWO);
    }

    @Test
    public void testEmitsOneBlockPerUpdate() {
        SignalBlock first = SignalBlock.zeros(2, 4);
        SignalBlock second = SignalBlock.zeros(2, 8);
        source.push(first);
        source.push(second);
        assertEquals(2, source.pending());

        source.update(); // initializes
        assertTrue(source.isInitialized());
        assertTrue(source.output().isEmpty());
        assertEquals(TWO, source.channelInfo());

        source.update();
        assertSame(first, source.output());
        source.update();
        assertSame(second, source.output());
        source.update();
        assertTrue(source.output().isEmpty());
    }

    @Test
    public void testEmptyPushIgnored() {
        source.push(SignalBlock.EMPTY);
        assertEquals(0, source.pending());
    }

    @Test
    public void testMismatchedBlockRejected() {
        try {
            source.push(SignalBlock.zeros(3, 4));
            fail("Expected NodeValidationException");
        } catch (NodeValidationException e) {
            assertTrue(e.getMessage().contains("3 channels"));
        }
    }

    @Test
    public void testCloseDrainsThenDies() {
        source.push(SignalBlock.zeros(2, 1));
        source.close();
        assertTrue(source.isAlive());
        source.update();
        source.update();
        assertFalse(source.isAlive());
        try {
            source.push(SignalBlock.zeros(2, 1));
            fail("Expected IllegalStateException");
        } catch (IllegalStateException e) {
            assertTrue(e.getMessage().contains("closed"));
        }
    }

    @Test
    public void testChangingDescriptorReinitializesAndDropsStaleBlocks() {
        source.update();
        source.push(SignalBlock.zeros(2, 4));
        source.setChannelInfo(THREE);
        assertEquals(NodeState.PENDING_RESET, source.state());
        source.push(SignalBlock.zeros(3, 4));

        source.update(); // reset = reinitialize
        assertEquals(NodeState.READY, source.state());
        assertEquals(THREE, source.channelInfo());
        assertEquals(1, source.pending());
        assertTrue(source.output().isEmpty());

        source.update();
        assertEquals(3, source.output().channelCount());
    }

    @Test
    public void testExposesChannelInfo() {
        source.update();
        assertTrue(source.exposesAttribute(SourceNode.CHANNEL_INFO));
        assertFalse(source.exposesAttribute("factor"));
        assertSame(TWO, source.attributeValue(SourceNode.CHANNEL_INFO));
        assertEquals(200.0, source.frequency(), 0.0);
    }

    @Test(expected = IllegalStateException.class)
    public void testFrequencyBeforeInitialization() {
        source.frequency();
    }
}
