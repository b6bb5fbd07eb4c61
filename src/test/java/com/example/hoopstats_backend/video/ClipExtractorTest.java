package com.example.hoopstats_backend.video;

import com.example.hoopstats_backend.exception.InvalidConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClipExtractorTest {

    private final ClipExtractor extractor = new ClipExtractor();

    private static List<Clip> drain(ClipExtractor.ClipCursor cursor) {
        List<Clip> clips = new ArrayList<>();
        cursor.forEachRemaining(clips::add);
        return clips;
    }

    @Test
    void twoHundredFramesAtThirtyFpsYieldFiveOverlappingClips() {
        InMemoryFrameSource source = new InMemoryFrameSource(30.0, 200);

        List<Clip> clips = drain(extractor.extract(source, new ClipSettings(2.0, 0.5, 30)));

        assertThat(clips).extracting(Clip::startFrame).containsExactly(0, 30, 60, 90, 120);
        assertThat(clips).allSatisfy(c -> assertThat(c.size()).isEqualTo(60));
        Clip second = clips.get(1);
        assertThat(second.frames().get(0).index()).isEqualTo(30);
        assertThat(second.frames().get(59).index()).isEqualTo(89);
        assertThat(second.timestampSec()).isEqualTo(1.0);
    }

    @Test
    void settingsDeriveFramesPerClipAndStride() {
        ClipSettings settings = new ClipSettings(2.0, 0.5, 30);

        assertThat(settings.framesPerClip(30.0)).isEqualTo(60);
        assertThat(settings.stride(30.0)).isEqualTo(30);
        assertThat(settings.framesPerClip(29.97)).isEqualTo(59);
    }

    @Test
    void stopsAtMaxClipsWithoutReadingTheRestOfTheVideo() {
        InMemoryFrameSource source = new InMemoryFrameSource(30.0, 10_000);

        ClipExtractor.ClipCursor cursor = extractor.extract(source, new ClipSettings(2.0, 0.5, 3));
        List<Clip> clips = drain(cursor);

        assertThat(clips).extracting(Clip::startFrame).containsExactly(0, 30, 60);
        assertThat(cursor.clipsEmitted()).isEqualTo(3);
        assertThat(source.framesGrabbed()).isEqualTo(120);
    }

    @Test
    void videoShorterThanOneClipYieldsNothing() {
        InMemoryFrameSource source = new InMemoryFrameSource(30.0, 59);

        ClipExtractor.ClipCursor cursor = extractor.extract(source, new ClipSettings(2.0, 0.5, 30));

        assertThat(cursor.hasNext()).isFalse();
        assertThat(cursor.framesRead()).isEqualTo(59);
        assertThatThrownBy(cursor::next).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void zeroOverlapProducesAdjacentClips() {
        InMemoryFrameSource source = new InMemoryFrameSource(10.0, 35);

        List<Clip> clips = drain(extractor.extract(source, new ClipSettings(1.0, 0.0, 30)));

        assertThat(clips).extracting(Clip::startFrame).containsExactly(0, 10, 20);
    }

    @Test
    void middleFrameIsTheCentreOfTheWindow() {
        InMemoryFrameSource source = new InMemoryFrameSource(30.0, 60);

        Clip clip = drain(extractor.extract(source, new ClipSettings(2.0, 0.5, 30))).get(0);

        assertThat(clip.middleFrame().index()).isEqualTo(30);
    }

    @Test
    void rejectsNonPositiveFrameRate() {
        assertThatThrownBy(() -> extractor.extract(new InMemoryFrameSource(0.0, 100), new ClipSettings(2.0, 0.5, 30)))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("frame rate");
        assertThatThrownBy(() -> extractor.extract(new InMemoryFrameSource(Double.NaN, 100), new ClipSettings(2.0, 0.5, 30)))
                .isInstanceOf(InvalidConfigurationException.class);
    }

    @Test
    void rejectsClipTooShortForAFrame() {
        assertThatThrownBy(() -> extractor.extract(new InMemoryFrameSource(30.0, 100), new ClipSettings(0.01, 0.5, 30)))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("no frames");
    }

    @Test
    void rejectsOverlapOutsideUnitInterval() {
        assertThatThrownBy(() -> extractor.extract(new InMemoryFrameSource(30.0, 100), new ClipSettings(2.0, 1.0, 30)))
                .isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> extractor.extract(new InMemoryFrameSource(30.0, 100), new ClipSettings(2.0, -0.1, 30)))
                .isInstanceOf(InvalidConfigurationException.class);
    }

    @Test
    void rejectsOverlapThatLeavesNoStride() {
        // 3 frames per clip, 0.9 overlap -> floor(0.3) = 0
        assertThatThrownBy(() -> extractor.extract(new InMemoryFrameSource(3.0, 100), new ClipSettings(1.0, 0.9, 30)))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("stride");
    }
}
