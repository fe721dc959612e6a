package com.questrail.keycode.protocol.passthrough;

import com.questrail.keycode.api.SecretKey;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

final class UartSecurityKeysTest
{
    @Test
    void derivesKnownKeyForSequentialBytes()
    {
        SecretKey key = SecretKey.fromHex("000102030405060708090a0b0c0d0e0f");

        assertEquals(SecretKey.fromHex("38792ffc241c2bc7c8cbf624593b5763"), UartSecurityKeys.derive(key));
    }

    @Test
    void eachHalfDependsOnlyOnItsOwnHalf()
    {
        byte[] changed = SecretKey.fromHex("000102030405060708090a0b0c0d0e0f").bytes();
        changed[15] ^= 0x01;

        byte[] a = UartSecurityKeys.derive(SecretKey.fromHex("000102030405060708090a0b0c0d0e0f")).bytes();
        byte[] b = UartSecurityKeys.derive(SecretKey.of(changed)).bytes();

        assertArrayEquals(Arrays.copyOfRange(a, 0, 8), Arrays.copyOfRange(b, 0, 8));
        assertFalse(Arrays.equals(Arrays.copyOfRange(a, 8, 16), Arrays.copyOfRange(b, 8, 16)));
    }

    @Test
    void derivationIsDeterministicAndKeyDependent()
    {
        SecretKey a = SecretKey.filled((byte) 0x01);
        SecretKey b = SecretKey.filled((byte) 0x02);

        assertEquals(UartSecurityKeys.derive(a), UartSecurityKeys.derive(a));
        assertNotEquals(UartSecurityKeys.derive(a), UartSecurityKeys.derive(b));
        assertNotEquals(a, UartSecurityKeys.derive(a));
    }
}
