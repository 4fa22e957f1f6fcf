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


import com.linkedin.data.ByteString;

import org.apache.commons.lang.ArrayUtils;


/**
 * Look-ahead buffer used by the decoder. Holds the bytes that have been fed but not yet resolved into
 * events, which is at most one boundary marker during body reading or one header block during header reading.
 *
 * Nothing here is thread safe. A buffer is owned by exactly one decoder.
 *
 * @author Karim Vidhani
 */
final class ByteStringBuffer
{
  private byte[] _bytes = ArrayUtils.EMPTY_BYTE_ARRAY;

  void add(final ByteString byteString)
  {
    if (byteString == null)
    {
      throw new IllegalArgumentException("Null ByteString provided");
    }
    add(byteString.copyBytes());
  }

  void add(final byte[] bytes)
  {
    if (bytes == null)
    {
      throw new IllegalArgumentException("Null byte array provided");
    }
    _bytes = ArrayUtils.addAll(_bytes, bytes);
  }

  int size()
  {
    return _bytes.length;
  }

  boolean isEmpty()
  {
    return _bytes.length == 0;
  }

  byte byteAtIndex(final int index)
  {
    if (index < 0 || index >= _bytes.length)
    {
      throw new IllegalArgumentException("Provided index " + index + " is out of range");
    }
    return _bytes[index];
  }

  /**
   * Returns the index of the first occurrence of the target bytes at or after {@code fromIndex}, or -1.
   */
  int indexOfBytes(final byte[] targetBytes, final int fromIndex)
  {
    if (targetBytes == null)
    {
      throw new IllegalArgumentException("Target byte array is null");
    }
    if (fromIndex < 0)
    {
      throw new IllegalArgumentException("Invalid start index specified");
    }

    if (targetBytes.length == 0)
    {
      return Math.min(fromIndex, _bytes.length);
    }

    outer:
    for (int i = fromIndex; i < _bytes.length - targetBytes.length + 1; i++)
    {
      for (int k = 0; k < targetBytes.length; k++)
      {
        if (_bytes[i + k] != targetBytes[k])
        {
          continue outer;
        }
      }
      return i;
    }
    return -1;
  }

  int indexOfBytes(final byte[] targetBytes)
  {
    return indexOfBytes(targetBytes, 0);
  }

  /**
   * True if the buffered bytes begin with the prefix. A buffer shorter than the prefix never matches.
   */
  boolean startsWith(final byte[] prefix)
  {
    return regionMatches(0, prefix, 0, prefix.length);
  }

  /**
   * True if every buffered byte is equal to the byte at the same position in the target. This is the case when
   * the buffer may still grow into the target.
   */
  boolean isPrefixOf(final byte[] target)
  {
    return _bytes.length <= target.length && regionMatches(0, target, 0, _bytes.length);
  }

  /**
   * Length of the longest suffix of the buffer that is a proper prefix of the target. Those bytes may be the
   * beginning of the target, split by a chunk edge, and must be kept.
   */
  int longestSuffixPrefixOf(final byte[] target)
  {
    final int maximum = Math.min(_bytes.length, target.length - 1);
    for (int length = maximum; length > 0; length--)
    {
      if (regionMatches(_bytes.length - length, target, 0, length))
      {
        return length;
      }
    }
    return 0;
  }

  private boolean regionMatches(final int offset, final byte[] target, final int targetOffset, final int length)
  {
    if (offset < 0 || offset + length > _bytes.length)
    {
      return false;
    }
    for (int i = 0; i < length; i++)
    {
      if (_bytes[offset + i] != target[targetOffset + i])
      {
        return false;
      }
    }
    return true;
  }

  /**
   * Copies the bytes in [startIndex, endIndex) into a new ByteString.
   */
  ByteString copy(final int startIndex, final int endIndex)
  {
    checkRange(startIndex, endIndex);
    if (startIndex == endIndex)
    {
      return ByteString.empty();
    }
    return ByteString.copy(_bytes, startIndex, endIndex - startIndex);
  }

  byte[] toByteArray(final int startIndex, final int endIndex)
  {
    checkRange(startIndex, endIndex);
    return ArrayUtils.subarray(_bytes, startIndex, endIndex);
  }

  /**
   * Forgets every byte before the new start index.
   */
  void trimFromBeginning(final int newStartIndex)
  {
    if (newStartIndex < 0 || newStartIndex > _bytes.length)
    {
      throw new IllegalArgumentException("Invalid new start index specified");
    }
    if (newStartIndex == 0)
    {
      return;
    }
    //A fresh copy lets the consumed prefix be garbage collected.
    _bytes = ArrayUtils.subarray(_bytes, newStartIndex, _bytes.length);
  }

  void clear()
  {
    _bytes = ArrayUtils.EMPTY_BYTE_ARRAY;
  }

  private void checkRange(final int startIndex, final int endIndex)
  {
    if (endIndex < startIndex || startIndex < 0 || endIndex > _bytes.length)
    {
      throw new IllegalArgumentException("Invalid range specified");
    }
  }

  @Override
  public String toString()
  {
    return new String(_bytes, MultiPartFormDataUtils.ASCII);
  }
}
