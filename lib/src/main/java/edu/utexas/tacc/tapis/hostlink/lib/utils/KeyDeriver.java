package edu.utexas.tacc.tapis.hostlink.lib.utils;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

import com.google.common.base.Preconditions;
import com.google.common.io.BaseEncoding;
import org.apache.commons.lang3.StringUtils;

/*
 * Derives the connection id used to name control sockets, registry rows and cache files.
 *
 * The id is the lowercase hex MD5 of the exact target string. No normalization is done, so
 *   "root@host" and "root@host:22" are two different connections. MD5 keeps the ids compatible with
 *   socket and cache files written by earlier shell based tooling.
 */
public final class KeyDeriver
{
  public static final int ID_LENGTH = 32;

  private static final String DIGEST_ALGORITHM = "MD5";

  private KeyDeriver() { throw new AssertionError(); }

  /**
   * @param target exact target string, for example admin@192.0.2.10:2200
   * @return 32 character hex digest
   */
  public static String deriveId(String target)
  {
    Preconditions.checkArgument(StringUtils.isNotEmpty(target), "Target must not be empty when deriving a connection id");
    try
    {
      MessageDigest digest = MessageDigest.getInstance(DIGEST_ALGORITHM);
      return BaseEncoding.base16().lowerCase().encode(digest.digest(target.getBytes(StandardCharsets.UTF_8)));
    }
    catch (NoSuchAlgorithmException e)
    {
      // Every JRE is required to provide MD5
      throw new IllegalStateException(e);
    }
  }
}
