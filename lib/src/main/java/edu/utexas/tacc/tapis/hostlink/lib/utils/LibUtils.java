package edu.utexas.tacc.tapis.hostlink.lib.utils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermissions;
import java.text.MessageFormat;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.MissingResourceException;
import java.util.ResourceBundle;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/*
   Utility class containing general use static methods.
   This class is non-instantiable
 */
public class LibUtils
{
  // Private constructor to make it non-instantiable
  private LibUtils() { throw new AssertionError(); }

  /* ********************************************************************** */
  /*                               Constants                                */
  /* ********************************************************************** */
  // Local logger.
  private static final Logger log = LoggerFactory.getLogger(LibUtils.class);

  // Location of message bundle files
  private static final String MESSAGE_BUNDLE = "edu.utexas.tacc.tapis.hostlink.lib.HostLinkMessages";

  // Format used when reporting registration and connection times
  private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

  public static final String UNKNOWN = "unknown";

  /* **************************************************************************** */
  /*                                Public Methods                                */
  /* **************************************************************************** */

  /**
   * Get a localized message using the specified key and parameters. Locale is null.
   * If there is a problem an error is logged and a special message is constructed with as much info as can be provided.
   * @param key message key
   * @param parms message parameters
   * @return localized message
   */
  public static String getMsg(String key, Object... parms)
  {
    return getMsg(key, null, parms);
  }

  /**
   * Get a localized message using the specified locale, key and parameters.
   * If there is a problem an error is logged and a special message is constructed with as much info as can be provided.
   * @param locale Locale for message
   * @param key message key
   * @param parms message parameters
   * @return localized message
   */
  public static String getMsg(String key, Locale locale, Object... parms)
  {
    String msgValue = null;

    if (locale == null) locale = Locale.getDefault();

    ResourceBundle bundle = null;
    try { bundle = ResourceBundle.getBundle(MESSAGE_BUNDLE, locale); }
    catch (MissingResourceException e)
    {
      log.error("Unable to find resource message bundle: " + MESSAGE_BUNDLE, e);
    }
    if (bundle != null) try
    {
      msgValue = bundle.getString(key);
    } catch (MissingResourceException e)
    {
      log.error("Unable to find key: " + key + " in resource message bundle: " + MESSAGE_BUNDLE, e);
    }

    if (msgValue != null)
    {
      // No problems. If needed fill in any placeholders in the message.
      if (parms != null && parms.length > 0) msgValue = MessageFormat.format(msgValue, parms);
    } else
    {
      // There was a problem. Build a message with as much info as we can give.
      StringBuilder sb = new StringBuilder("Key: ").append(key).append(" not found in bundle: ").append(MESSAGE_BUNDLE);
      if (parms != null && parms.length > 0)
      {
        sb.append("Parameters:[");
        for (Object parm : parms)
        {
          sb.append(parm).append(",");
        }
        sb.append("]");
      }
      msgValue = sb.toString();
    }
    return msgValue;
  }

  /**
   * Format an epoch seconds value as local date and time, yyyy-MM-dd HH:mm:ss.
   * A non-positive value is reported as unknown.
   */
  public static String formatEpochSeconds(long epochSeconds, ZoneId zone)
  {
    if (epochSeconds <= 0) return UNKNOWN;
    return TIME_FORMATTER.format(Instant.ofEpochSecond(epochSeconds).atZone(zone));
  }

  /**
   * Create a directory, and any missing parents, readable only by the owner where POSIX permissions are supported.
   * An existing directory is left as it is.
   * @param dir directory to create
   * @throws IOException if the directory cannot be created
   */
  public static void ensurePrivateDir(Path dir) throws IOException
  {
    if (Files.isDirectory(dir)) return;
    Files.createDirectories(dir);
    try
    {
      Files.setPosixFilePermissions(dir, PosixFilePermissions.fromString("rwx------"));
    }
    catch (UnsupportedOperationException e)
    {
      log.debug("Filesystem for {} does not support POSIX permissions", dir);
    }
  }

  /**
   * Replace the content of a file so that readers see either the old or the new content, never a mix.
   * The content goes to a uniquely named temp file in the same directory which is then renamed over the destination.
   * On failure the temp file is removed and the destination is left untouched.
   * @param dest file to replace
   * @param content new content, written as UTF-8
   * @throws IOException on error
   */
  public static void writeAtomically(Path dest, String content) throws IOException
  {
    Path tmp = dest.resolveSibling(dest.getFileName() + ".tmp." + UUID.randomUUID());
    try
    {
      Files.writeString(tmp, content, StandardCharsets.UTF_8);
      try
      {
        Files.move(tmp, dest, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      }
      catch (AtomicMoveNotSupportedException e)
      {
        Files.move(tmp, dest, StandardCopyOption.REPLACE_EXISTING);
      }
    }
    finally
    {
      Files.deleteIfExists(tmp);
    }
  }
}
