package com.lbg.markets.surveillance.courier.exception;

public class ChecksumMismatchException extends TransferException {

    private final String expected;
    private final String actual;

    public ChecksumMismatchException(String expected, String actual) {
        super(ErrorKind.CHECKSUM_MISMATCH,
                String.format("Checksum mismatch: expected=%s, calculated=%s", expected, actual));
        this.expected = expected;
        this.actual = actual;
    }

    public String getExpected() {
        return expected;
    }

    public String getActual() {
        return actual;
    }
}
