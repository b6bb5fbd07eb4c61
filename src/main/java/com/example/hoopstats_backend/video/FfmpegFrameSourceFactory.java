package com.example.hoopstats_backend.video;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

@Component
public class FfmpegFrameSourceFactory implements FrameSourceFactory {
    private final String ffmpegBin;
    private final String ffprobeBin;

    public FfmpegFrameSourceFactory(@Value("${video.ffmpeg-binary:ffmpeg}") String ffmpegBin,
                                    @Value("${video.ffprobe-binary:ffprobe}") String ffprobeBin) {
        this.ffmpegBin = ffmpegBin;
        this.ffprobeBin = ffprobeBin;
    }

    @Override
    public FrameSource open(Path video) {
        return FfmpegFrameSource.open(video, ffmpegBin, ffprobeBin);
    }
}
