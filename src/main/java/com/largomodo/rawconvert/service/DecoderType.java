package com.largomodo.rawconvert.service;

/**
 * Raw decoding backends selectable from the command line.
 */
public enum DecoderType {

    /** External dcraw binary; supports every common camera raw format. */
    DCRAW {
        @Override
        public RawDecoder create(String dcrawPath) {
            return new DcrawDecoder(dcrawPath);
        }
    },

    /** JDK ImageIO readers; no external tool, limited to formats ImageIO understands. */
    IMAGEIO {
        @Override
        public RawDecoder create(String dcrawPath) {
            return new ImageIoDecoder();
        }
    };

    /**
     * Instantiate the decoder.
     *
     * @param dcrawPath path or command name of dcraw (ignored by decoders that do not use it)
     */
    public abstract RawDecoder create(String dcrawPath);

    public boolean requiresExternalTool() {
        return this == DCRAW;
    }
}
