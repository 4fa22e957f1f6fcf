/*
   Copyright (c) 2015 LinkedIn Corp.

   Licensed under the Apache License, Version 2.0 (the "License");
   you may not use this file except in compliance with the License.
   You may obtain a copy of the License at

       http://www.apache.org/licenses/LICENSE-2.0

   Unless required by applicable law or agreed to in writing, software
   distributed under the License is distributed on an "AS IS" BASIS,
   WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
   See the License for the specific language governing permissions and
   limitations under the License.
*/

package com.linkedin.formdata;


import java.io.ByteArrayOutputStream;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;


/**
 * A header value in the form of {@code token; n1=v1; n2="v2" ...}, such as
 *
 * <pre>
 *   Content-Disposition: form-data; name="file"; filename="a.txt"
 *   Content-Type: text/plain; charset=UTF-8
 * </pre>
 *
 * Parameter names are lower-cased. The token and the parameter values keep their case. Values may be a bare token
 * or a quoted string in which a backslash escapes the next character. Extended parameters from RFC 2231, such as
 * {@code filename*=UTF-8''na%C3%AFve.txt} and the continuations {@code title*0}, {@code title*1*}, are decoded and
 * stored under the plain parameter name. An extended value overrides a plain one.
 *
 * Parsing is loose. A parameter without '=' is ignored and an unterminated quoted string ends the value list.
 */
public final class ParameterizedHeader
{
  private final String _token;
  private final Map<String, String> _parameters;

  public ParameterizedHeader(final String token, final Map<String, String> parameters)
  {
    _token = token;
    _parameters = Collections.unmodifiableMap(new LinkedHashMap<String, String>(parameters));
  }

  /**
   * The leading token, for example {@code form-data} or {@code text/plain}. May be empty.
   */
  public String getToken()
  {
    return _token;
  }

  /**
   * Looks up a parameter. The name is matched case insensitively.
   *
   * @return the decoded value or null if the parameter is absent.
   */
  public String getParameter(final String name)
  {
    return _parameters.get(name.toLowerCase(Locale.ROOT));
  }

  public Map<String, String> getParameters()
  {
    return _parameters;
  }

  @Override
  public String toString()
  {
    final StringBuilder builder = new StringBuilder(_token);
    for (final Map.Entry<String, String> parameter : _parameters.entrySet())
    {
      builder.append("; ").append(parameter.getKey()).append('=')
          .append(MultiPartFormDataUtils.quoteParameterValueIfNeeded(parameter.getValue()));
    }
    return builder.toString();
  }

  public static ParameterizedHeader parse(final String headerValue)
  {
    if (headerValue == null)
    {
      return new ParameterizedHeader("", Collections.<String, String>emptyMap());
    }

    final int length = headerValue.length();
    final int tokenEnd = indexOfSemicolon(headerValue, 0);
    final String token = headerValue.substring(0, tokenEnd).trim();

    //Plain values keyed by name, in order of first appearance. Extended values and continuations are
    //collected separately so they can be resolved once every parameter was seen.
    final Map<String, String> plain = new LinkedHashMap<String, String>();
    final Map<String, String> extended = new LinkedHashMap<String, String>();
    final Map<String, TreeMap<Integer, Section>> continuations = new LinkedHashMap<String, TreeMap<Integer, Section>>();
    final Map<String, Boolean> order = new LinkedHashMap<String, Boolean>();

    int i = tokenEnd;
    while (i < length)
    {
      //headerValue[i] is a semicolon.
      i++;
      final int nextSemicolon = indexOfSemicolon(headerValue, i);
      final int equalsIndex = headerValue.indexOf('=', i);
      if (equalsIndex == -1 || equalsIndex > nextSemicolon)
      {
        i = nextSemicolon;
        continue;
      }

      final String rawName = headerValue.substring(i, equalsIndex).trim().toLowerCase(Locale.ROOT);
      int valueStart = equalsIndex + 1;
      while (valueStart < length && isWhiteSpace(headerValue.charAt(valueStart)))
      {
        valueStart++;
      }

      final String value;
      if (valueStart < length && headerValue.charAt(valueStart) == '"')
      {
        final int closingQuote = findClosingQuote(headerValue, valueStart);
        if (closingQuote == -1)
        {
          break;
        }
        final String quoted = headerValue.substring(valueStart + 1, closingQuote);
        value = keepVerbatim(rawName, quoted) ? quoted : unescape(quoted);
        i = indexOfSemicolon(headerValue, closingQuote + 1);
      }
      else
      {
        value = headerValue.substring(valueStart, nextSemicolon).trim();
        i = nextSemicolon;
      }

      if (rawName.isEmpty())
      {
        continue;
      }

      final int star = rawName.indexOf('*');
      if (star == -1)
      {
        plain.put(rawName, value);
        order.put(rawName, Boolean.TRUE);
      }
      else if (star == rawName.length() - 1)
      {
        final String name = rawName.substring(0, star);
        if (!name.isEmpty())
        {
          extended.put(name, value);
          order.put(name, Boolean.TRUE);
        }
      }
      else
      {
        addContinuation(rawName, star, value, continuations, order);
      }
    }

    final Map<String, String> parameters = new LinkedHashMap<String, String>();
    for (final String name : order.keySet())
    {
      String resolved = null;
      if (extended.containsKey(name))
      {
        resolved = decodeExtendedValue(extended.get(name));
      }
      if (resolved == null && continuations.containsKey(name))
      {
        resolved = joinContinuations(continuations.get(name));
      }
      if (resolved == null)
      {
        resolved = plain.get(name);
      }
      if (resolved != null)
      {
        parameters.put(name, resolved);
      }
    }

    return new ParameterizedHeader(token, parameters);
  }

  private static void addContinuation(final String rawName, final int star, final String value,
      final Map<String, TreeMap<Integer, Section>> continuations, final Map<String, Boolean> order)
  {
    final String name = rawName.substring(0, star);
    String index = rawName.substring(star + 1);
    final boolean encoded = index.endsWith("*");
    if (encoded)
    {
      index = index.substring(0, index.length() - 1);
    }
    if (name.isEmpty() || index.isEmpty() || index.length() > 4)
    {
      return;
    }
    for (int k = 0; k < index.length(); k++)
    {
      if (!Character.isDigit(index.charAt(k)))
      {
        return;
      }
    }

    TreeMap<Integer, Section> sections = continuations.get(name);
    if (sections == null)
    {
      sections = new TreeMap<Integer, Section>();
      continuations.put(name, sections);
    }
    sections.put(Integer.parseInt(index), new Section(value, encoded));
    order.put(name, Boolean.TRUE);
  }

  //Sections must be numbered 0, 1, 2... without gaps. Anything after a gap is dropped as RFC 2231 requires.
  private static String joinContinuations(final TreeMap<Integer, Section> sections)
  {
    Charset charset = null;
    final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    int expected = 0;
    for (final Map.Entry<Integer, Section> entry : sections.entrySet())
    {
      if (entry.getKey() != expected)
      {
        break;
      }
      final Section section = entry.getValue();
      String text = section._value;
      if (section._encoded)
      {
        if (expected == 0)
        {
          final int firstQuote = text.indexOf('\'');
          final int secondQuote = firstQuote == -1 ? -1 : text.indexOf('\'', firstQuote + 1);
          if (secondQuote == -1)
          {
            return null;
          }
          charset = lookupCharset(text.substring(0, firstQuote));
          if (charset == null)
          {
            return null;
          }
          text = text.substring(secondQuote + 1);
        }
        final byte[] decoded = percentDecode(text);
        bytes.write(decoded, 0, decoded.length);
      }
      else
      {
        final byte[] raw = text.getBytes(charset == null ? MultiPartFormDataUtils.UTF_8 : charset);
        bytes.write(raw, 0, raw.length);
      }
      expected++;
    }
    if (expected == 0)
    {
      return null;
    }
    return new String(bytes.toByteArray(), charset == null ? MultiPartFormDataUtils.UTF_8 : charset);
  }

  /**
   * Decodes {@code charset'language'percent-encoded-text}. Returns null if the value is not well formed or names
   * a charset this JVM does not support.
   */
  static String decodeExtendedValue(final String value)
  {
    final int firstQuote = value.indexOf('\'');
    final int secondQuote = firstQuote == -1 ? -1 : value.indexOf('\'', firstQuote + 1);
    if (secondQuote == -1)
    {
      return null;
    }
    final Charset charset = lookupCharset(value.substring(0, firstQuote));
    if (charset == null)
    {
      return null;
    }
    return new String(percentDecode(value.substring(secondQuote + 1)), charset);
  }

  private static Charset lookupCharset(final String name)
  {
    if (name.isEmpty())
    {
      return MultiPartFormDataUtils.UTF_8;
    }
    try
    {
      return Charset.forName(name);
    }
    catch (IllegalCharsetNameException e)
    {
      return null;
    }
    catch (UnsupportedCharsetException e)
    {
      return null;
    }
  }

  //A '%' not followed by two hex digits is taken literally.
  static byte[] percentDecode(final String text)
  {
    final ByteArrayOutputStream bytes = new ByteArrayOutputStream(text.length());
    for (int i = 0; i < text.length(); i++)
    {
      final char c = text.charAt(i);
      if (c == '%' && i + 2 < text.length() && hexValue(text.charAt(i + 1)) != -1 && hexValue(text.charAt(i + 2)) != -1)
      {
        bytes.write((hexValue(text.charAt(i + 1)) << 4) | hexValue(text.charAt(i + 2)));
        i += 2;
      }
      else
      {
        final byte[] raw = String.valueOf(c).getBytes(MultiPartFormDataUtils.UTF_8);
        bytes.write(raw, 0, raw.length);
      }
    }
    return bytes.toByteArray();
  }

  private static int hexValue(final char c)
  {
    return Character.digit(c, 16);
  }

  //Old versions of Internet Explorer send the full UNC path as the filename, which must not be unescaped.
  private static boolean keepVerbatim(final String name, final String quoted)
  {
    return MultiPartFormDataUtils.FILENAME_PARAMETER.equals(name) && quoted.startsWith("\\\\");
  }

  private static String unescape(final String quoted)
  {
    if (quoted.indexOf('\\') == -1)
    {
      return quoted;
    }
    final StringBuilder builder = new StringBuilder(quoted.length());
    boolean escaped = false;
    for (int i = 0; i < quoted.length(); i++)
    {
      final char c = quoted.charAt(i);
      if (!escaped && c == '\\')
      {
        escaped = true;
        continue;
      }
      escaped = false;
      builder.append(c);
    }
    return builder.toString();
  }

  //Index of the closing quote for the quoted string opening at start, or -1 if it is never closed.
  private static int findClosingQuote(final String string, final int start)
  {
    boolean escaped = false;
    for (int i = start + 1; i < string.length(); i++)
    {
      final char c = string.charAt(i);
      if (escaped)
      {
        escaped = false;
      }
      else if (c == '\\')
      {
        escaped = true;
      }
      else if (c == '"')
      {
        return i;
      }
    }
    return -1;
  }

  private static int indexOfSemicolon(final String string, final int from)
  {
    final int index = string.indexOf(';', from);
    return index == -1 ? string.length() : index;
  }

  private static boolean isWhiteSpace(final char c)
  {
    return c == ' ' || c == '\t';
  }

  private static final class Section
  {
    private final String _value;
    private final boolean _encoded;

    private Section(final String value, final boolean encoded)
    {
      _value = value;
      _encoded = encoded;
    }
  }
}
