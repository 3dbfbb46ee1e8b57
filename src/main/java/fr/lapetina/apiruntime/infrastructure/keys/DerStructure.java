package fr.lapetina.apiruntime.infrastructure.keys;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Minimal DER reader used to describe key material.
 *
 * Only the shapes needed to find an RSA modulus are modelled: SEQUENCE,
 * INTEGER and BIT STRING. Every other element is kept as an opaque
 * {@link Other}. Parsing is strict about lengths: a buffer parses only if its
 * elements consume it exactly.
 */
final class DerStructure {

    private static final Logger log = LoggerFactory.getLogger(DerStructure.class);

    private static final int TAG_INTEGER = 0x02;
    private static final int TAG_BIT_STRING = 0x03;
    private static final int TAG_SEQUENCE = 0x30;

    private DerStructure() {
    }

    sealed interface Element permits Sequence, DerInteger, BitString, Other {
    }

    record Sequence(List<Element> children) implements Element {
        public Sequence {
            children = List.copyOf(children);
        }
    }

    /**
     * @param content two's complement big-endian value bytes, as encoded
     */
    record DerInteger(byte[] content) implements Element {

        public BigInteger value() {
            return new BigInteger(content);
        }

        /**
         * Significant bits of a positive value, empty for zero or negative values.
         */
        public Optional<Integer> positiveBitLength() {
            if (content.length == 0 || (content[0] & 0x80) != 0) {
                return Optional.empty();
            }
            int start = 0;
            while (start < content.length && content[start] == 0) {
                start++;
            }
            if (start == content.length) {
                return Optional.empty();
            }
            int leading = Integer.numberOfLeadingZeros(content[start] & 0xff) - 24;
            return Optional.of((content.length - start) * 8 - leading);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof DerInteger other && Arrays.equals(content, other.content);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(content);
        }

        @Override
        public String toString() {
            return "DerInteger{bytes=" + content.length + '}';
        }
    }

    /**
     * @param unusedBits number of padding bits in the last payload byte
     * @param payload    bit string bytes, without the leading unused-bits byte
     */
    record BitString(int unusedBits, byte[] payload) implements Element {

        @Override
        public boolean equals(Object o) {
            return o instanceof BitString other
                    && unusedBits == other.unusedBits
                    && Arrays.equals(payload, other.payload);
        }

        @Override
        public int hashCode() {
            return 31 * unusedBits + Arrays.hashCode(payload);
        }

        @Override
        public String toString() {
            return "BitString{unusedBits=" + unusedBits + ", bytes=" + payload.length + '}';
        }
    }

    record Other(int tag, int length) implements Element {
    }

    /**
     * Parses a complete DER buffer into its top-level elements.
     *
     * @throws IllegalArgumentException if the buffer is not well-formed DER
     */
    static List<Element> parseAll(byte[] der) {
        return new Reader(der, 0, der.length).readAll();
    }

    /**
     * Size of the first RSA modulus found in {@code der}, searched depth first.
     *
     * A SEQUENCE whose first element is a positive INTEGER is taken to hold
     * the modulus. Otherwise its elements are searched in order, descending
     * into BIT STRING payloads that are themselves DER (SubjectPublicKeyInfo).
     */
    static Optional<Integer> rsaModulusBits(byte[] der) {
        List<Element> elements;
        try {
            elements = parseAll(der);
        } catch (IllegalArgumentException e) {
            log.debug("Key material is not parseable DER: {}", e.getMessage());
            return Optional.empty();
        }
        for (Element element : elements) {
            Optional<Integer> bits = findModulusBits(element);
            if (bits.isPresent()) {
                return bits;
            }
        }
        return Optional.empty();
    }

    private static Optional<Integer> findModulusBits(Element element) {
        if (element instanceof Sequence sequence) {
            List<Element> children = sequence.children();
            if (!children.isEmpty() && children.get(0) instanceof DerInteger first) {
                Optional<Integer> bits = first.positiveBitLength();
                if (bits.isPresent()) {
                    return bits;
                }
            }
            for (Element child : children) {
                Optional<Integer> bits = findModulusBits(child);
                if (bits.isPresent()) {
                    return bits;
                }
            }
            return Optional.empty();
        }
        if (element instanceof BitString bitString && bitString.unusedBits() == 0) {
            List<Element> nested;
            try {
                nested = parseAll(bitString.payload());
            } catch (IllegalArgumentException e) {
                return Optional.empty();
            }
            for (Element child : nested) {
                Optional<Integer> bits = findModulusBits(child);
                if (bits.isPresent()) {
                    return bits;
                }
            }
        }
        return Optional.empty();
    }

    private static final class Reader {

        private final byte[] buffer;
        private final int end;
        private int position;

        Reader(byte[] buffer, int offset, int end) {
            this.buffer = buffer;
            this.position = offset;
            this.end = end;
        }

        List<Element> readAll() {
            if (position >= end) {
                throw new IllegalArgumentException("empty DER input");
            }
            List<Element> elements = new ArrayList<>();
            while (position < end) {
                elements.add(readElement());
            }
            return elements;
        }

        private Element readElement() {
            int tag = next();
            if ((tag & 0x1f) == 0x1f) {
                throw new IllegalArgumentException("multi-byte tags are not supported");
            }
            int length = readLength();
            if (length > end - position) {
                throw new IllegalArgumentException("element length " + length + " exceeds remaining " + (end - position));
            }
            int contentStart = position;
            position += length;
            return switch (tag) {
                case TAG_SEQUENCE -> new Sequence(length == 0
                        ? List.of()
                        : new Reader(buffer, contentStart, contentStart + length).readAll());
                case TAG_INTEGER -> {
                    if (length == 0) {
                        throw new IllegalArgumentException("empty INTEGER");
                    }
                    yield new DerInteger(Arrays.copyOfRange(buffer, contentStart, contentStart + length));
                }
                case TAG_BIT_STRING -> {
                    if (length == 0) {
                        throw new IllegalArgumentException("empty BIT STRING");
                    }
                    int unused = buffer[contentStart] & 0xff;
                    if (unused > 7) {
                        throw new IllegalArgumentException("invalid unused bit count: " + unused);
                    }
                    yield new BitString(unused, Arrays.copyOfRange(buffer, contentStart + 1, contentStart + length));
                }
                default -> new Other(tag, length);
            };
        }

        private int readLength() {
            int first = next();
            if (first < 0x80) {
                return first;
            }
            int octets = first & 0x7f;
            if (octets == 0 || octets > 4) {
                throw new IllegalArgumentException("unsupported length encoding: 0x" + Integer.toHexString(first));
            }
            long length = 0;
            for (int i = 0; i < octets; i++) {
                length = (length << 8) | next();
            }
            if (length > Integer.MAX_VALUE) {
                throw new IllegalArgumentException("length too large: " + length);
            }
            return (int) length;
        }

        private int next() {
            if (position >= end) {
                throw new IllegalArgumentException("truncated DER input");
            }
            return buffer[position++] & 0xff;
        }
    }
}
