package com.example.slides.dedup;

import java.awt.image.BufferedImage;

public interface FingerprintEngine {
    /**
     * Compute the perceptual fingerprint of a decoded image.
     * @param image Image of at least 2x1 pixels, any colour model
     * @return Fingerprint of {@link #getBitLength()} bits
     */
    Fingerprint fingerprint(BufferedImage image);

    /**
     * Load the candidate's image and fingerprint it.
     * @param candidate Frame to read
     * @return Fingerprint of the candidate's image
     * @throws FrameDecodeException if the image cannot be opened or decoded
     */
    default Fingerprint fingerprint(CandidateFrame candidate) throws FrameDecodeException {
        return fingerprint(candidate.loadImage());
    }

    /**
     * @return Number of bits in every fingerprint this engine produces
     */
    int getBitLength();
}
