package com.example.shab;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

final class Fixtures {
    static final String BLEIN_ID = "bb0b8622-803e-413e-8d71-bb6da17f5b0c";
    static final String COMPANY_ID = "7f3c2a10-1b44-4c55-9d0e-2a8b6c1d9e77";
    static final String HR02_ID = "0e9f1d2c-3b4a-4c5d-8e7f-6a5b4c3d2e1f";
    static final String SION_OFFICE_ID = "4095950d-a5d2-11e8-99a2-0050569d3c43";

    private Fixtures() {
    }

    static byte[] bytes(String name) {
        try (InputStream is = Fixtures.class.getClassLoader().getResourceAsStream("fixtures/" + name)) {
            if (is == null) {
                throw new IllegalArgumentException("Missing fixture " + name);
            }
            return is.readAllBytes();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** Fixture decoded the way the pipeline decodes fetched XML. */
    static String xml(String name) {
        try {
            return XmlSupport.decode(bytes(name));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    static String blein() {
        return xml(BLEIN_ID + ".xml");
    }
}
