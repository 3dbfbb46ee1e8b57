package fr.lapetina.apiruntime.infrastructure.keys;

import fr.lapetina.apiruntime.infrastructure.config.ConfigurationException;

import java.util.Arrays;
import java.util.Base64;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * First PEM block found in a piece of text.
 *
 * @param label block label, e.g. {@code PUBLIC KEY}
 * @param der   decoded body
 */
record PemDocument(String label, byte[] der) {

    private static final Pattern BLOCK = Pattern.compile(
            "-----BEGIN ([A-Z0-9 ]+)-----(.*?)-----END \\1-----", Pattern.DOTALL);

    static PemDocument parse(String text) {
        Matcher matcher = BLOCK.matcher(text);
        if (!matcher.find()) {
            throw new ConfigurationException("malformed key material: no PEM block found");
        }
        byte[] der;
        try {
            der = Base64.getMimeDecoder().decode(matcher.group(2).trim());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("malformed key material: invalid base64 in PEM block "
                    + matcher.group(1), e);
        }
        if (der.length == 0) {
            throw new ConfigurationException("malformed key material: empty PEM block " + matcher.group(1));
        }
        return new PemDocument(matcher.group(1), der);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof PemDocument other && label.equals(other.label) && Arrays.equals(der, other.der);
    }

    @Override
    public int hashCode() {
        return 31 * label.hashCode() + Arrays.hashCode(der);
    }

    @Override
    public String toString() {
        return "PemDocument{label='" + label + "', bytes=" + der.length + '}';
    }
}
