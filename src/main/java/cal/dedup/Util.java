package cal.dedup;

import cal.prim.IOConsumer;
import cal.prim.MalformedDataException;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.io.PipedInputStream;
import java.io.PipedOutputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicReference;

public abstract class Util {

  /**
   * The suggested size of in-memory byte buffers for I/O.
   * The value is 8192, which is currently the size used by {@link BufferedInputStream}
   * on desktop JVMs.
   */
  public static final int SUGGESTED_BUFFER_SIZE = 8192;

  /**
   * A thread-local byte array of {@link #SUGGESTED_BUFFER_SIZE} bytes.
   */
  private static final ThreadLocal<byte[]> MEM_BUFFER = ThreadLocal.withInitial(() -> new byte[SUGGESTED_BUFFER_SIZE]);

  public static long copyStream(InputStream in, OutputStream out) throws IOException {
    byte[] buf = MEM_BUFFER.get();
    long count = 0;
    int n;
    while ((n = in.read(buf)) >= 0) {
      out.write(buf, 0, n);
      count += n;
    }
    return count;
  }

  public static MessageDigest sha256Digest() {
    MessageDigest md;
    try {
      md = MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException e) {
      // This should never happen; all JREs are required to support
      // SHA-256 (as well as MD5 and SHA-1).
      throw new UnsupportedOperationException();
    }
    return md;
  }

  public static BufferedInputStream buffered(InputStream in) {
    return new BufferedInputStream(in, SUGGESTED_BUFFER_SIZE);
  }

  public static byte[] read(InputStream in) throws IOException {
    try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
      copyStream(in, out);
      return out.toByteArray();
    }
  }

  public static byte[] sha256(byte[] data) {
    return sha256Digest().digest(data);
  }

  private static final String HEX_CHARS = "0123456789abcdef";
  public static String sha256toString(byte[] sha256) {
    StringBuilder builder = new StringBuilder();
    for (byte b : sha256) {
      int i = Byte.toUnsignedInt(b);
      builder.append(HEX_CHARS.charAt((i >> 4) & 0xF));
      builder.append(HEX_CHARS.charAt(i & 0xF));
    }
    return builder.toString();
  }

  /**
   * Convert a single lower-case hexadecimal digit to its integer value.
   * Upper-case digits are rejected so that every checksum has exactly one
   * textual form.
   *
   * @param c a character
   * @return an int in the range [0, 15]
   */
  private static int hexValue(char c) {
    int i = HEX_CHARS.indexOf(c);
    if (i < 0) {
      throw new IllegalArgumentException("character " + c + " is not a lower-case hex digit");
    }
    return i;
  }

  /**
   * Inverse of {@link #sha256toString(byte[])}.
   *
   * @param sha256 64 lower-case hex digits
   * @return the 32 bytes they describe
   * @throws IllegalArgumentException if the string is not a well-formed checksum
   */
  public static byte[] stringToSha256(CharSequence sha256) {
    int len = sha256.length();
    if (len != 64) {
      throw new IllegalArgumentException("string has the wrong length to be a SHA-256 sum (should be 64, was " + len + ')');
    }
    byte[] sum = new byte[32];
    for (int i = 0; i < sum.length; ++i) {
      char c1 = sha256.charAt(i * 2);
      char c2 = sha256.charAt(i * 2 + 1);
      int val1 = hexValue(c1);
      int val2 = hexValue(c2);
      sum[i] = (byte)(val1 << 4 | val2);
    }
    return sum;
  }

  private static int byteToUnsignedInt(byte b) {
    return ((int)b) & 0xFF;
  }

  public static long readBigEndianUnsignedInt(byte[] buffer, int offset) {
    return ((long)byteToUnsignedInt(buffer[offset]) << 24)
            | (byteToUnsignedInt(buffer[offset + 1]) << 16)
            | (byteToUnsignedInt(buffer[offset + 2]) << 8)
            | byteToUnsignedInt(buffer[offset + 3]);
  }

  public static int readBigEndianInt(InputStream data) throws IOException, MalformedDataException {
    byte[] buffer = new byte[4];
    if (readChunk(data, buffer) < buffer.length) {
      throw new MalformedDataException("Not enough bytes in the input stream");
    }
    return (int)readBigEndianUnsignedInt(buffer, 0);
  }

  public static void serializeBigEndianInt(int i, byte[] buffer, int offset) {
    buffer[offset] = (byte)(i >> 24);
    buffer[offset + 1] = (byte)(i >> 16);
    buffer[offset + 2] = (byte)(i >> 8);
    buffer[offset + 3] = (byte)i;
  }

  public static InputStream createInputStream(IOConsumer<OutputStream> writer) {
    PipedInputStream in = new PipedInputStream(SUGGESTED_BUFFER_SIZE);
    CountDownLatch gate = new CountDownLatch(1);
    AtomicReference<Exception> err = new AtomicReference<>(null);

    Thread t = new Thread(() -> {
      try (PipedOutputStream out = new PipedOutputStream(in)) {
        gate.countDown();
        writer.accept(out);
      } catch (Exception e) {
        err.set(e);
      } finally {
        // If an exception was thrown constructing the PipedOutputStream,
        // then unblock the waiting parent thread.
        while (gate.getCount() > 0) {
          gate.countDown();
        }
      }
    });
    t.start();

    boolean interrupted = false;
    for (;;) {
      try {
        gate.await();
        break;
      } catch (InterruptedException e) {
        interrupted = true;
      }
    }
    if (interrupted) {
      Thread.currentThread().interrupt();
    }

    return new FilterInputStream(in) {
      @Override
      public void close() throws IOException {
        try {
          drain(this.in);
          t.join();
          Exception e = err.get();
          if (e != null) {
            throw new IOException("byte producer failed", e);
          }
        } catch (InterruptedException e) {
          throw new InterruptedIOException();
        } finally {
          super.close();
        }
      }
    };
  }

  public static long drain(InputStream in) throws IOException {
    byte[] buf = MEM_BUFFER.get();
    long count = 0;
    int n;
    while ((n = in.read(buf)) >= 0) {
      count += n;
    }
    return count;
  }

  public static int readChunk(InputStream in, byte[] chunk) throws IOException {
    int soFar = 0;
    int n;
    while (soFar < chunk.length && (n = in.read(chunk, soFar, chunk.length - soFar)) >= 0) {
      soFar += n;
    }
    return soFar;
  }

}
