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


/**
 * Something the decoder observed in the stream. There are exactly three kinds, which are the nested classes of this
 * class. Consumers either switch on {@link #getType()} or implement {@link DecodeEventHandler} and call
 * {@link #accept(DecodeEventHandler)}, in which case the compiler checks that every kind is handled.
 *
 * @author Karim Vidhani
 */
public abstract class DecodeEvent
{
  public enum Type
  {
    PART_STARTED,
    BODY_CHUNK,
    PART_ENDED
  }

  //Only the nested classes may extend this class.
  private DecodeEvent()
  {
  }

  public abstract Type getType();

  public abstract void accept(DecodeEventHandler handler);

  /**
   * A boundary followed by a complete header block was read.
   */
  public static final class PartStarted extends DecodeEvent
  {
    private final PartHeaders _headers;
    private final String _name;
    private final String _filename;

    public PartStarted(final PartHeaders headers, final String name, final String filename)
    {
      if (headers == null || name == null)
      {
        throw new IllegalArgumentException("Headers and name are required");
      }
      _headers = headers;
      _name = name;
      _filename = filename;
    }

    @Override
    public Type getType()
    {
      return Type.PART_STARTED;
    }

    @Override
    public void accept(final DecodeEventHandler handler)
    {
      handler.onPartStarted(this);
    }

    public PartHeaders getHeaders()
    {
      return _headers;
    }

    /**
     * The name parameter of the Content-Disposition header.
     */
    public String getName()
    {
      return _name;
    }

    /**
     * The filename parameter of the Content-Disposition header, or null for a plain field.
     */
    public String getFilename()
    {
      return _filename;
    }

    public boolean isFile()
    {
      return _filename != null;
    }

    /**
     * The Content-Type header of the part, or null if it was not sent.
     */
    public String getContentType()
    {
      return _headers.get(MultiPartFormDataUtils.CONTENT_TYPE_HEADER);
    }

    @Override
    public boolean equals(final Object o)
    {
      if (this == o)
      {
        return true;
      }
      if (!(o instanceof PartStarted))
      {
        return false;
      }
      final PartStarted that = (PartStarted) o;
      return _headers.equals(that._headers) && _name.equals(that._name)
          && (_filename == null ? that._filename == null : _filename.equals(that._filename));
    }

    @Override
    public int hashCode()
    {
      int result = _headers.hashCode();
      result = 31 * result + _name.hashCode();
      result = 31 * result + (_filename == null ? 0 : _filename.hashCode());
      return result;
    }

    @Override
    public String toString()
    {
      return "PartStarted{name=" + _name + ", filename=" + _filename + ", headers=" + _headers + "}";
    }
  }

  /**
   * A non-empty run of body bytes of the current part.
   */
  public static final class BodyChunk extends DecodeEvent
  {
    private final ByteString _data;

    public BodyChunk(final ByteString data)
    {
      if (data == null || data.isEmpty())
      {
        throw new IllegalArgumentException("Body chunks may not be empty");
      }
      _data = data;
    }

    @Override
    public Type getType()
    {
      return Type.BODY_CHUNK;
    }

    @Override
    public void accept(final DecodeEventHandler handler)
    {
      handler.onBodyChunk(this);
    }

    public ByteString getData()
    {
      return _data;
    }

    @Override
    public boolean equals(final Object o)
    {
      return this == o || (o instanceof BodyChunk && _data.equals(((BodyChunk) o)._data));
    }

    @Override
    public int hashCode()
    {
      return _data.hashCode();
    }

    @Override
    public String toString()
    {
      return "BodyChunk{length=" + _data.length() + "}";
    }
  }

  /**
   * The current part is complete.
   */
  public static final class PartEnded extends DecodeEvent
  {
    public static final PartEnded INSTANCE = new PartEnded();

    private PartEnded()
    {
    }

    @Override
    public Type getType()
    {
      return Type.PART_ENDED;
    }

    @Override
    public void accept(final DecodeEventHandler handler)
    {
      handler.onPartEnded(this);
    }

    @Override
    public String toString()
    {
      return "PartEnded";
    }
  }
}
