package com.questrail.keycode.protocol.model;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

final class BitStringTest
{
    @Test
    void leadingZerosAreSignificant()
    {
        BitString a = BitString.of(3, 4);
        BitString b = BitString.of(3, 2);

        assertEquals("0011", a.toString());
        assertEquals("11", b.toString());
        assertNotEquals(a, b);
    }

    @Test
    void valueWiderThanLengthIsRejected()
    {
        assertThrows(IllegalArgumentException.class, () -> BitString.of(8, 3));
        assertThrows(IllegalArgumentException.class, () -> BitString.of(-1, 8));
    }

    @Test
    void appendConcatenatesMostSignificantFirst()
    {
        BitString bits = BitString.parse("101").append(BitString.parse("0011"));

        assertEquals("1010011", bits.toString());
        assertEquals(0b1010011, bits.toLong());
        assertEquals(7, bits.length());
    }

    @Test
    void sliceExtractsHalfOpenRange()
    {
        BitString bits = BitString.parse("110100111");

        assertEquals("0100", bits.slice(2, 6).toString());
        assertEquals("", bits.slice(4, 4).toString());
        assertThrows(IndexOutOfBoundsException.class, () -> bits.slice(5, 10));
    }

    @Test
    void xorRequiresEqualLengths()
    {
        BitString a = BitString.parse("1100");

        assertEquals("0110", a.xor(BitString.parse("1010")).toString());
        assertThrows(IllegalArgumentException.class, () -> a.xor(BitString.parse("10")));
    }

    @Test
    void toByteArrayLeftPadsToWholeBytes()
    {
        assertArrayEquals(new byte[] { 0x07 }, BitString.parse("0111").toByteArray());
        assertArrayEquals(new byte[] { 0x06, (byte) 0xFA }, BitString.of(0x6FA, 12).toByteArray());
        assertArrayEquals(new byte[] { 0x00, 0x01 }, BitString.of(1, 16).toByteArray());
        assertArrayEquals(new byte[] { (byte) 0x80 }, BitString.parse("10000000").toByteArray());
        assertArrayEquals(new byte[0], BitString.empty().toByteArray());
    }

    @Test
    void fromBytesKeepsEveryBit()
    {
        BitString bits = BitString.fromBytes(new byte[] { 0x00, (byte) 0xFF });

        assertEquals(16, bits.length());
        assertEquals("0000000011111111", bits.toString());
    }

    @Test
    void bitIndexesFromMostSignificant()
    {
        BitString bits = BitString.parse("100");

        assertTrue(bits.bit(0));
        assertFalse(bits.bit(2));
    }

    @Test
    void wideStringsConvertToBigInteger()
    {
        BitString bits = BitString.of(BigInteger.ONE.shiftLeft(76), 77);

        assertEquals(BigInteger.ONE.shiftLeft(76), bits.toBigInteger());
        assertThrows(ArithmeticException.class, bits::toLong);
    }

    @Test
    void parseRejectsNonBinaryCharacters()
    {
        assertThrows(IllegalArgumentException.class, () -> BitString.parse("0102"));
    }
}
