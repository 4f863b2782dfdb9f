package io.chatrelay.core.assembly;

import static org.assertj.core.api.Assertions.assertThat;

import io.chatrelay.core.model.ContentPart;
import io.chatrelay.core.model.MessageContent;
import io.chatrelay.core.model.MessageRole;
import io.chatrelay.core.model.OutboundMessage;
import io.chatrelay.core.model.Turn;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class MessageAssemblerTest {

    private final MessageAssembler assembler = new MessageAssembler();

    @Test
    void shouldPassPlainTextTurnsThroughWhenNoImages() {
        List<Turn> transcript = List.of(Turn.user("hi"), Turn.assistant("hello"), Turn.user("how are you"));

        AssemblyResult result = assembler.build(transcript, "how are you", null);

        assertThat(result).isInstanceOf(AssemblyResult.Assembled.class);
        assertThat(((AssemblyResult.Assembled) result).messages()).containsExactly(
            OutboundMessage.of(Turn.user("hi")),
            OutboundMessage.of(Turn.assistant("hello")),
            OutboundMessage.of(Turn.user("how are you"))
        );
        assertThat(assembler.build(transcript, "how are you", List.of()))
            .isEqualTo(new AssemblyResult.Assembled(((AssemblyResult.Assembled) result).messages()));
    }

    @Test
    void shouldReplaceOnlyFinalUserTurnWithMultiPartBody() {
        List<Turn> transcript = List.of(Turn.user("earlier"), Turn.assistant("reply"), Turn.user("describe these"));

        AssemblyResult result = assembler.build(
            transcript,
            "describe these",
            List.of("https://ex.com/a.png", "http://ex.com/b.jpg")
        );

        List<OutboundMessage> messages = ((AssemblyResult.Assembled) result).messages();
        assertThat(messages).hasSize(3);
        assertThat(messages.subList(0, 2)).containsExactly(
            OutboundMessage.of(Turn.user("earlier")),
            OutboundMessage.of(Turn.assistant("reply"))
        );
        OutboundMessage last = messages.get(2);
        assertThat(last.role()).isEqualTo(MessageRole.USER);
        assertThat(last.content()).isEqualTo(new MessageContent.MultiPart(List.of(
            new ContentPart.Text("describe these"),
            new ContentPart.ImageRef("https://ex.com/a.png"),
            new ContentPart.ImageRef("http://ex.com/b.jpg")
        )));
    }

    @Test
    void shouldAppendSyntheticUserTurnWhenLastTurnIsNotUser() {
        List<Turn> transcript = List.of(Turn.user("q"), Turn.assistant("a"));

        AssemblyResult result = assembler.build(transcript, "look", List.of("https://ex.com/a.png"));

        List<OutboundMessage> messages = ((AssemblyResult.Assembled) result).messages();
        assertThat(messages).hasSize(3);
        assertThat(messages.get(1)).isEqualTo(OutboundMessage.of(Turn.assistant("a")));
        assertThat(messages.get(2).content()).isEqualTo(new MessageContent.MultiPart(List.of(
            new ContentPart.Text("look"),
            new ContentPart.ImageRef("https://ex.com/a.png")
        )));
    }

    @Test
    void shouldAppendSyntheticUserTurnWhenTranscriptIsEmpty() {
        AssemblyResult result = assembler.build(List.of(), "look", List.of("https://ex.com/a.png"));

        List<OutboundMessage> messages = ((AssemblyResult.Assembled) result).messages();
        assertThat(messages).hasSize(1);
        assertThat(messages.get(0).role()).isEqualTo(MessageRole.USER);
        assertThat(messages.get(0).content()).isInstanceOf(MessageContent.MultiPart.class);
    }

    @Test
    void shouldRejectNonHttpReferencesWithoutBuildingAList() {
        List<Turn> transcript = List.of(Turn.user("see"));

        AssemblyResult ftp = assembler.build(transcript, "see", List.of("https://ok.com/a.png", "ftp://x/y.png"));
        AssemblyResult bare = assembler.build(transcript, "see", List.of("not-a-url"));

        assertThat(ftp).isEqualTo(new AssemblyResult.Rejected("ftp://x/y.png", "image_urls must be HTTP/HTTPS: ftp://x/y.png"));
        assertThat(bare).isInstanceOf(AssemblyResult.Rejected.class);
        assertThat(((AssemblyResult.Rejected) bare).invalidReference()).isEqualTo("not-a-url");
    }

    @Test
    void shouldNotMutateTheGivenTranscript() {
        List<Turn> transcript = new ArrayList<>(List.of(Turn.assistant("a")));

        assembler.build(transcript, "look", List.of("https://ex.com/a.png"));

        assertThat(transcript).containsExactly(Turn.assistant("a"));
    }

    @Test
    void imageReferenceValidationShouldRequireAbsoluteHttpUrlWithHost() {
        assertThat(ImageReferences.isValid("https://ex.com/a.png")).isTrue();
        assertThat(ImageReferences.isValid("HTTP://EX.COM/A.PNG")).isTrue();
        assertThat(ImageReferences.isValid("https:///a.png")).isFalse();
        assertThat(ImageReferences.isValid("/relative/a.png")).isFalse();
        assertThat(ImageReferences.isValid("data:image/png;base64,AAAA")).isFalse();
        assertThat(ImageReferences.isValid(" https://ex.com/a.png")).isFalse();
        assertThat(ImageReferences.isValid("")).isFalse();
        assertThat(ImageReferences.isValid(null)).isFalse();
    }
}
