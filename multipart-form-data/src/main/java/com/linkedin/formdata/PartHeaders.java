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


import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;


/**
 * The headers of a single part, in the order they first appeared.
 *
 * Lookups are case insensitive. {@link #asMap()} is keyed by the lower-cased name, while
 * {@link #getOriginalName(String)} returns the name as it was written so the part can be re-encoded faithfully.
 * If a header repeats, the first occurrence fixes its position and the last value wins.
 */
public final class PartHeaders
{
  private static final PartHeaders EMPTY = new PartHeaders(Collections.<String, Header>emptyMap());

  private final Map<String, Header> _headers;

  private PartHeaders(final Map<String, Header> headers)
  {
    _headers = headers;
  }

  public static PartHeaders empty()
  {
    return EMPTY;
  }

  /**
   * Value of the header, or null if absent.
   */
  public String get(final String name)
  {
    final Header header = _headers.get(name.toLowerCase(Locale.ROOT));
    return header == null ? null : header._value;
  }

  public boolean contains(final String name)
  {
    return _headers.containsKey(name.toLowerCase(Locale.ROOT));
  }

  /**
   * Name of the header as it appeared on the wire, or null if absent.
   */
  public String getOriginalName(final String name)
  {
    final Header header = _headers.get(name.toLowerCase(Locale.ROOT));
    return header == null ? null : header._originalName;
  }

  /**
   * Lower-cased header names in order of appearance.
   */
  public List<String> names()
  {
    return Collections.unmodifiableList(new ArrayList<String>(_headers.keySet()));
  }

  /**
   * Read only view keyed by lower-cased header name.
   */
  public Map<String, String> asMap()
  {
    final Map<String, String> map = new LinkedHashMap<String, String>();
    for (final Map.Entry<String, Header> entry : _headers.entrySet())
    {
      map.put(entry.getKey(), entry.getValue()._value);
    }
    return Collections.unmodifiableMap(map);
  }

  /**
   * Headers keyed by the name as written on the wire.
   */
  public Map<String, String> asOriginalMap()
  {
    final Map<String, String> map = new LinkedHashMap<String, String>();
    for (final Header header : _headers.values())
    {
      map.put(header._originalName, header._value);
    }
    return Collections.unmodifiableMap(map);
  }

  public int size()
  {
    return _headers.size();
  }

  public boolean isEmpty()
  {
    return _headers.isEmpty();
  }

  @Override
  public boolean equals(final Object o)
  {
    if (this == o)
    {
      return true;
    }
    if (!(o instanceof PartHeaders))
    {
      return false;
    }
    return asMap().equals(((PartHeaders) o).asMap());
  }

  @Override
  public int hashCode()
  {
    return asMap().hashCode();
  }

  @Override
  public String toString()
  {
    return asOriginalMap().toString();
  }

  /**
   * Accumulates headers. Not reusable after {@link #build()}.
   */
  public static final class Builder
  {
    private final Map<String, Header> _headers = new LinkedHashMap<String, Header>();

    public Builder addHeader(final String name, final String value)
    {
      final String key = name.toLowerCase(Locale.ROOT);
      final Header existing = _headers.get(key);
      if (existing == null)
      {
        _headers.put(key, new Header(name, value));
      }
      else
      {
        //Keeps the position of the first occurrence.
        _headers.put(key, new Header(existing._originalName, value));
      }
      return this;
    }

    public PartHeaders build()
    {
      if (_headers.isEmpty())
      {
        return EMPTY;
      }
      return new PartHeaders(Collections.unmodifiableMap(new LinkedHashMap<String, Header>(_headers)));
    }
  }

  private static final class Header
  {
    private final String _originalName;
    private final String _value;

    private Header(final String originalName, final String value)
    {
      _originalName = originalName;
      _value = value;
    }
  }
}
