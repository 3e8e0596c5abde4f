/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.quarry.exec.physical.impl.decode;

import static org.apache.quarry.exec.physical.impl.decode.DecodeFixtures.CITY;
import static org.apache.quarry.exec.physical.impl.decode.DecodeFixtures.COUNTRY;
import static org.apache.quarry.exec.physical.impl.decode.DecodeFixtures.CREATED;
import static org.apache.quarry.exec.physical.impl.decode.DecodeFixtures.NOTE;
import static org.apache.quarry.exec.physical.impl.decode.DecodeFixtures.PRICE;
import static org.apache.quarry.exec.physical.impl.decode.DecodeFixtures.SALES;
import static org.apache.quarry.exec.physical.impl.decode.DecodeFixtures.salesRelation;
import static org.apache.quarry.exec.physical.impl.decode.DecodeFixtures.surrogateSchema;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.apache.quarry.common.types.DataMode;
import org.apache.quarry.common.types.MinorType;
import org.apache.quarry.common.types.Types;
import org.apache.quarry.exec.metadata.DataKind;
import org.apache.quarry.exec.metadata.DimensionDescriptor;
import org.apache.quarry.exec.metadata.TableIdentifier;
import org.apache.quarry.exec.metadata.TableMetadata;
import org.apache.quarry.exec.record.BatchSchema;
import org.apache.quarry.exec.record.FieldReference;
import org.apache.quarry.exec.record.MaterializedField;
import org.apache.quarry.test.QuarryTest;
import org.junit.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

public class TestDecodePlan extends QuarryTest {

  private static DecodePlan plan(BatchSchema schema, DecodeProfile profile) {
    return DecodePlan.build(schema, profile, ImmutableList.of(salesRelation(schema)), DecoderAliasMap.empty());
  }

  @Test
  public void includeOnlyDecodesListedColumn() {
    BatchSchema schema = surrogateSchema(CITY, COUNTRY);
    DecodePlan plan = plan(schema, new IncludeProfile(ImmutableList.of(schema.getColumn(0).getReference())));

    assertEquals(2, plan.size());
    DecodePlan.Entry city = plan.getEntry(0);
    assertNotNull(city);
    assertEquals("sales", city.getTableName());
    assertEquals(CITY.getColumnIdentifier(), city.getColumnIdentifier());
    assertSame(CITY, city.getDimension());
    assertNull(plan.getEntry(1));
    assertTrue(plan.isRequiredToDecode());

    BatchSchema output = plan.getOutputSchema();
    assertEquals(Types.optional(MinorType.VARCHAR), output.getColumn(0).getType());
    assertEquals(schema.getColumn(1), output.getColumn(1));
  }

  @Test
  public void allowAllDecodesEveryEligibleColumn() {
    BatchSchema schema = surrogateSchema(CITY, NOTE, CREATED, COUNTRY);
    DecodePlan plan = plan(schema, new AllowAllProfile());

    assertNotNull(plan.getEntry(0));
    assertNull("not dictionary encoded", plan.getEntry(1));
    assertNull("direct dictionary", plan.getEntry(2));
    assertNotNull(plan.getEntry(3));
  }

  @Test
  public void emptyIncludeDecodesNothing() {
    BatchSchema schema = surrogateSchema(CITY, COUNTRY);
    DecodePlan plan = plan(schema, new IncludeProfile(ImmutableList.<FieldReference>of()));

    assertFalse(plan.isRequiredToDecode());
    assertEquals(2, plan.size());
    assertNull(plan.getEntry(0));
    assertNull(plan.getEntry(1));
    assertEquals(schema, plan.getOutputSchema());
  }

  @Test
  public void emptyExcludeMatchesAllowAll() {
    BatchSchema schema = surrogateSchema(CITY, NOTE, COUNTRY);
    DecodePlan exclude = plan(schema, new ExcludeProfile(ImmutableList.<FieldReference>of()));
    DecodePlan all = plan(schema, new AllowAllProfile());
    assertEquals(all.getOutputSchema(), exclude.getOutputSchema());
    for (int i = 0; i < schema.getFieldCount(); i++) {
      assertEquals(all.getEntry(i) == null, exclude.getEntry(i) == null);
    }
  }

  @Test
  public void undeclaredDecimalIsReportedAs18And2() {
    BatchSchema schema = surrogateSchema(PRICE);
    DecodePlan plan = plan(schema, new AllowAllProfile());
    assertEquals(Types.withPrecisionAndScale(MinorType.VARDECIMAL, DataMode.OPTIONAL, 18, 2),
        plan.getOutputSchema().getColumn(0).getType());
  }

  @Test
  public void complexDimensionsAreNeverDecoded() {
    DimensionDescriptor tags = DecodeFixtures.dictionary("tags", DataKind.ARRAY)
        .child(DimensionDescriptor.builder("tags.val", DataKind.STRING).dictionary().build())
        .build();
    TableMetadata table = new TableMetadata(SALES, ImmutableList.of(tags));
    BatchSchema schema = BatchSchema.of(MaterializedField.create("tags", 1, Types.optional(MinorType.LIST)));
    DecodePlan plan = DecodePlan.build(schema, new AllowAllProfile(),
        ImmutableList.<DecoderRelation>of(new TableDecoderRelation(table, ImmutableList.of(schema.getColumn(0).getReference()))),
        DecoderAliasMap.empty());

    assertNull(plan.getEntry(0));
    assertEquals(schema, plan.getOutputSchema());
  }

  @Test
  public void columnsOutsideEveryRelationAreSkipped() {
    BatchSchema schema = surrogateSchema(CITY, COUNTRY);
    DecoderRelation onlyCity = new TableDecoderRelation(DecodeFixtures.SALES_TABLE,
        ImmutableList.of(schema.getColumn(0).getReference()));
    DecodePlan plan = DecodePlan.build(schema, new AllowAllProfile(),
        ImmutableList.of(onlyCity), DecoderAliasMap.empty());
    assertNotNull(plan.getEntry(0));
    assertNull(plan.getEntry(1));
  }

  @Test
  public void aliasResolvesToCanonicalColumn() {
    FieldReference canonical = new FieldReference("city", 1);
    FieldReference alias = new FieldReference("town", 42);
    BatchSchema schema = BatchSchema.of(MaterializedField.create(alias, Types.optional(MinorType.INT)));
    DecoderRelation relation = new TableDecoderRelation(DecodeFixtures.SALES_TABLE, ImmutableList.of(canonical));

    DecodePlan withoutAlias = DecodePlan.build(schema, new AllowAllProfile(),
        ImmutableList.of(relation), DecoderAliasMap.empty());
    assertNull(withoutAlias.getEntry(0));

    DecodePlan withAlias = DecodePlan.build(schema, new AllowAllProfile(),
        ImmutableList.of(relation), new DecoderAliasMap(ImmutableMap.of(alias, canonical)));
    assertSame(CITY, withAlias.getEntry(0).getDimension());
    assertEquals("town", withAlias.getOutputSchema().getColumn(0).getName());
  }

  @Test
  public void firstContainingRelationOwnsTheColumn() {
    TableIdentifier otherId = new TableIdentifier("default", "stores", "stores-0001");
    TableMetadata other = new TableMetadata(otherId, ImmutableList.of(DecodeFixtures.dictionary("city", DataKind.STRING).build()));
    BatchSchema schema = surrogateSchema(CITY);
    List<DecoderRelation> relations = ImmutableList.<DecoderRelation>of(
        new TableDecoderRelation(other, ImmutableList.of(schema.getColumn(0).getReference())),
        salesRelation(schema));

    DecodePlan plan = DecodePlan.build(schema, new AllowAllProfile(), relations, DecoderAliasMap.empty());
    assertEquals("stores", plan.getEntry(0).getTableName());
    assertEquals(otherId, plan.getEntry(0).getDictionaryColumnIdentifier().getTableIdentifier());
  }

  @Test
  public void buildingTwiceGivesTheSamePlan() {
    BatchSchema schema = surrogateSchema(CITY, NOTE, PRICE);
    DecodePlan first = plan(schema, new AllowAllProfile());
    DecodePlan second = plan(schema, new AllowAllProfile());
    assertEquals(first.getOutputSchema(), second.getOutputSchema());
    for (int i = 0; i < schema.getFieldCount(); i++) {
      assertEquals(first.getEntry(i) == null, second.getEntry(i) == null);
    }
  }
}
