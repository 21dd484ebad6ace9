package com.bloom.recommender.service.profile;

import com.bloom.recommender.config.RecommenderProperties;
import com.bloom.recommender.model.Evidence;
import com.bloom.recommender.model.SignalCorpus;
import com.bloom.recommender.model.SignalSource;
import com.bloom.recommender.model.SocialEvidence;
import com.bloom.recommender.model.StructuredSignals;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SignalCorpusBuilderTest {

    private final SignalCorpusBuilder builder = new SignalCorpusBuilder(new RecommenderProperties());

    @Test
    public void twoMessagesAreNotEnough() {
        InsufficientSignalException ex = assertThrows(InsufficientSignalException.class,
                () -> builder.build(Evidence.conversation("User: hi\nAssistant: hello")));
        assertEquals(2, ex.getObservedCount());
        assertEquals(3, ex.getRequiredCount());
    }

    @Test
    public void unprefixedTranscriptIsASingleMessage() {
        assertEquals(1, SignalCorpusBuilder.splitMessages("line one\nline two\nline three").size());
        assertThrows(InsufficientSignalException.class,
                () -> builder.build(Evidence.conversation("line one\nline two\nline three")));
    }

    @Test
    public void splitsOnRolePrefixedLinesAndDropsEmptyMessages() {
        List<String> messages = SignalCorpusBuilder.splitMessages(
                "User: first\ncontinued\nAssistant: second\nUser:   \nHuman: third");
        assertEquals(3, messages.size());
        assertTrue(messages.get(0).contains("continued"));
    }

    @Test
    public void rolePrefixesDoNotLeakIntoText() {
        SignalCorpus corpus = builder.build(Evidence.conversation(
                "User: hello there\nAI: hi\nUser: how are you\nAI: fine"));
        assertEquals(4, corpus.getMessageCount());
        assertFalse(corpus.fullText().contains("ai:"));
        assertFalse(corpus.fullText().contains("user:"));
    }

    @Test
    public void topicsComeFromUserLinesOnly() {
        SignalCorpus corpus = builder.build(Evidence.conversation(
                "User: I do meditation and yoga\nAssistant: have you tried crypto wallets and defi?\nUser: mindfulness and sleep matter"));
        assertEquals(List.of("Wellness"), corpus.getTopics());
    }

    @Test
    public void mergesSocialAndStructuredEvidence() {
        SocialEvidence social = new SocialEvidence("builder of things",
                List.of("new launch today", "quiet day", "alpha release is out"),
                List.of("alice", "bob"));
        StructuredSignals structured = new StructuredSignals(List.of("a", "b"), List.of("eth"),
                List.of("uniswap"), List.of("vote"), 2);
        SignalCorpus corpus = builder.build(new Evidence("User: one\nUser: two\nUser: three", social, structured));

        assertEquals(3, corpus.segmentCount(SignalSource.CONVERSATION));
        assertEquals(5, corpus.segmentCount(SignalSource.SOCIAL_PROFILE));
        assertEquals(1, corpus.segmentCount(SignalSource.STRUCTURED));
        assertEquals(3, corpus.getSocial().getPostCount());
        assertEquals(2, corpus.getSocial().getFollowingCount());
        assertEquals(2, corpus.getSocial().getTrendPostCount());
        assertTrue(corpus.hasStructuredSignals());
        assertTrue(corpus.fullText().contains("uniswap"));
    }

    @Test
    public void minimumIsConfigurable() {
        SignalCorpus corpus = builder.build(Evidence.conversation("User: just one"), 1);
        assertEquals(1, corpus.getMessageCount());
    }
}
