package com.barte.sdk.model;

import com.barte.sdk.decode.DecodingException;
import com.barte.sdk.decode.JsonFields;

import java.util.Objects;

/** QR-code data carried by a PIX charge. */
public final class PixDetails {
    /** "Copia e cola" payload, e.g. {@code 000201...}. */
    public final String pixCode;

    /** URL of the rendered QR-code image. */
    public final String pixQRCodeImage;

    public PixDetails(String pixCode, String pixQRCodeImage) {
        this.pixCode = pixCode;
        this.pixQRCodeImage = pixQRCodeImage;
    }

    static PixDetails decode(JsonFields fields) throws DecodingException {
        return new PixDetails(fields.requireText("pixCode"), fields.requireText("pixQRCodeImage"));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PixDetails)) return false;
        PixDetails that = (PixDetails) o;
        return pixCode.equals(that.pixCode) && pixQRCodeImage.equals(that.pixQRCodeImage);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pixCode, pixQRCodeImage);
    }
}
